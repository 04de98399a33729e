package com.dicalc.adapter.in.web;

import com.dicalc.adapter.in.web.calculation.CalculationHandler;
import com.dicalc.adapter.in.web.export.ExportHandler;
import com.dicalc.adapter.in.web.rates.RateLookupHandler;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for calculation, report and rate endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final CalculationHandler calculationHandler;
    private final ExportHandler exportHandler;
    private final RateLookupHandler rateLookupHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        router.post("/api/calculations")
                .handler(BodyHandler.create())
                .handler(calculationHandler);

        router.post("/api/reports/:caseId/sections")
                .handler(BodyHandler.create())
                .handler(exportHandler);

        router.get("/api/rates/:term")
                .handler(rateLookupHandler);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"debt-interest-calculator\"}");
                });

        // Root endpoint
        router.get("/")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"name\":\"Debt Interest Calculator\",\"version\":\"1.0.0\"}");
                });
    }
}
