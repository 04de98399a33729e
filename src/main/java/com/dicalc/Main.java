package com.dicalc;

import com.dicalc.adapter.in.web.HttpServerVerticle;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Debt Interest Calculator...");

        // Write PID to file for easy process management
        writePidToFile();

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(2);

        Vertx vertx = Vertx.vertx(options);

        JsonObject config = loadConfig();
        int port = config.getJsonObject("http", new JsonObject()).getInteger("port", 8080);

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                .setConfig(config)
                .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Debt Interest Calculator...");
                        vertx.close();
                    }));

                    log.info("Debt Interest Calculator is ready!");
                    log.info("API Endpoint: http://localhost:{}/api/calculations", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    static JsonObject loadConfig() {
        try (InputStream is = Main.class.getClassLoader().getResourceAsStream("application.yml")) {
            if (is == null) {
                throw new IllegalStateException("application.yml not found in classpath");
            }
            Map<String, Object> yaml = new ObjectMapper(new YAMLFactory())
                    .readValue(is, new TypeReference<Map<String, Object>>() {});
            JsonObject config = new JsonObject(yaml);
            log.info("Loaded configuration from application.yml");
            return config;
        } catch (IOException e) {
            log.error("Failed to load application.yml: {}", e.getMessage());
            throw new IllegalStateException("Configuration error: application.yml required", e);
        }
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
