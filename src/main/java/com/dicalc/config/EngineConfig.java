package com.dicalc.config;

import com.dicalc.domain.model.RateTerm;
import io.vertx.core.json.JsonObject;
import lombok.Value;

import java.math.BigDecimal;
import java.nio.file.Path;

/**
 * Typed view of the verticle configuration loaded from application.yml
 */
@Value
public class EngineConfig {

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_RATE_SNAPSHOT = "rates/lpr-rates.yaml";
    public static final String DEFAULT_REPORT_DIRECTORY = "reports";
    public static final BigDecimal DEFAULT_CAP_MULTIPLIER = BigDecimal.valueOf(4);

    int httpPort;
    String rateSnapshot;
    Path reportDirectory;
    BigDecimal penaltyCapMultiplier;
    RateTerm penaltyCapTerm;

    public static EngineConfig fromJson(JsonObject config) {
        JsonObject http = section(config, "http");
        JsonObject rates = section(config, "rates");
        JsonObject reports = section(config, "reports");
        JsonObject penalty = section(config, "penalty");

        String capMultiplier = penalty.getValue("capMultiplier") == null
                ? null
                : String.valueOf(penalty.getValue("capMultiplier"));

        return new EngineConfig(
                http.getInteger("port", DEFAULT_PORT),
                rates.getString("snapshot", DEFAULT_RATE_SNAPSHOT),
                Path.of(reports.getString("directory", DEFAULT_REPORT_DIRECTORY)),
                capMultiplier == null ? DEFAULT_CAP_MULTIPLIER : new BigDecimal(capMultiplier),
                RateTerm.fromValue(penalty.getString("capTerm", RateTerm.SHORT_TERM.name()))
        );
    }

    private static JsonObject section(JsonObject config, String name) {
        JsonObject section = config == null ? null : config.getJsonObject(name);
        return section == null ? new JsonObject() : section;
    }
}
