package com.dicalc.adapter.out.rates;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads a rate table snapshot from the classpath
 */
@Slf4j
public class RateTableSnapshotLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public RateTableSnapshot load(String resource) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            RateTableSnapshot snapshot = yamlMapper.readValue(is, RateTableSnapshot.class);
            if (snapshot.entries() == null || snapshot.entries().isEmpty()) {
                throw new IllegalStateException(resource + " contains no rate entries");
            }
            log.info("Loaded rate table {} with {} publications (as of {})",
                    snapshot.version(), snapshot.entries().size(), snapshot.asOf());
            return snapshot;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rate table " + resource, e);
        }
    }
}
