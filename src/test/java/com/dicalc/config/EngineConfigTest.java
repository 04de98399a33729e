package com.dicalc.config;

import com.dicalc.domain.model.RateTerm;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void testDefaultsWhenSectionsMissing() {
        EngineConfig config = EngineConfig.fromJson(new JsonObject());

        assertEquals(8080, config.getHttpPort());
        assertEquals("rates/lpr-rates.yaml", config.getRateSnapshot());
        assertEquals(Path.of("reports"), config.getReportDirectory());
        assertEquals(BigDecimal.valueOf(4), config.getPenaltyCapMultiplier());
        assertEquals(RateTerm.SHORT_TERM, config.getPenaltyCapTerm());
    }

    @Test
    void testNullConfigUsesDefaults() {
        assertEquals(8080, EngineConfig.fromJson(null).getHttpPort());
    }

    @Test
    void testReadsNestedSections() {
        JsonObject json = new JsonObject()
                .put("http", new JsonObject().put("port", 9090))
                .put("rates", new JsonObject().put("snapshot", "rates/other.yaml"))
                .put("reports", new JsonObject().put("directory", "/var/reports"))
                .put("penalty", new JsonObject().put("capMultiplier", 3.5).put("capTerm", "5y"));

        EngineConfig config = EngineConfig.fromJson(json);

        assertEquals(9090, config.getHttpPort());
        assertEquals("rates/other.yaml", config.getRateSnapshot());
        assertEquals(Path.of("/var/reports"), config.getReportDirectory());
        assertEquals(new BigDecimal("3.5"), config.getPenaltyCapMultiplier());
        assertEquals(RateTerm.LONG_TERM, config.getPenaltyCapTerm());
    }
}
