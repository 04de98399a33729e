package com.dicalc.adapter.in.web;

import com.dicalc.adapter.in.web.calculation.CalculationHandler;
import com.dicalc.adapter.in.web.export.ExportHandler;
import com.dicalc.adapter.in.web.rates.RateLookupHandler;
import com.dicalc.adapter.out.rates.RateTableSnapshotLoader;
import com.dicalc.adapter.out.rates.SnapshotRateTableAdapter;
import com.dicalc.adapter.out.report.ExcelReportSink;
import com.dicalc.application.engine.AuditTrailGenerator;
import com.dicalc.application.engine.CalculationModeDispatcher;
import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.application.engine.PaymentOffsetAllocator;
import com.dicalc.application.engine.PeriodSegmenter;
import com.dicalc.application.engine.RateCapValidator;
import com.dicalc.application.engine.mode.CompoundInterestCalculator;
import com.dicalc.application.engine.mode.DelayedInterestCalculator;
import com.dicalc.application.engine.mode.FloatingInterestCalculator;
import com.dicalc.application.engine.mode.PenaltyInterestCalculator;
import com.dicalc.application.engine.mode.SimpleInterestCalculator;
import com.dicalc.application.port.in.InterestCalculationUseCase;
import com.dicalc.application.port.in.RateLookupUseCase;
import com.dicalc.application.port.in.ReportExportUseCase;
import com.dicalc.application.port.out.RateTableProvider;
import com.dicalc.application.port.out.ReportSink;
import com.dicalc.application.service.CalculationRequestMapper;
import com.dicalc.application.service.InterestCalculationService;
import com.dicalc.application.service.RateLookupService;
import com.dicalc.application.service.ReportExportService;
import com.dicalc.application.service.RequestValidator;
import com.dicalc.config.EngineConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private EngineConfig engineConfig;
    private CalculationHandler calculationHandler;
    private ExportHandler exportHandler;
    private RateLookupHandler rateLookupHandler;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeServices()
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", engineConfig.getHttpPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeServices() {
        try {
            engineConfig = EngineConfig.fromJson(config());

            // Output ports (adapters)
            RateTableProvider rateTable = SnapshotRateTableAdapter.fromSnapshot(
                    new RateTableSnapshotLoader().load(engineConfig.getRateSnapshot()));
            ReportSink reportSink = new ExcelReportSink(vertx, engineConfig.getReportDirectory());

            // Engine
            DayCountEngine dayCount = new DayCountEngine();
            CalculationModeDispatcher dispatcher = new CalculationModeDispatcher(
                    new PeriodSegmenter(rateTable, dayCount),
                    new PaymentOffsetAllocator(),
                    new RateCapValidator(rateTable, dayCount),
                    rateTable,
                    List.of(
                            new SimpleInterestCalculator(dayCount),
                            new FloatingInterestCalculator(dayCount),
                            new DelayedInterestCalculator(dayCount),
                            new CompoundInterestCalculator(dayCount),
                            new PenaltyInterestCalculator(dayCount)
                    )
            );
            AuditTrailGenerator auditTrail = new AuditTrailGenerator();

            // Application services (use cases)
            InterestCalculationUseCase calculationUseCase = new InterestCalculationService(
                    new RequestValidator(),
                    new CalculationRequestMapper(dayCount,
                            engineConfig.getPenaltyCapMultiplier(), engineConfig.getPenaltyCapTerm()),
                    dispatcher
            );
            ReportExportUseCase exportUseCase = new ReportExportService(calculationUseCase, auditTrail, reportSink);
            RateLookupUseCase rateLookupUseCase = new RateLookupService(rateTable);

            // Input adapters (handlers)
            calculationHandler = new CalculationHandler(calculationUseCase, auditTrail);
            exportHandler = new ExportHandler(exportUseCase);
            rateLookupHandler = new RateLookupHandler(rateLookupUseCase);

            log.info("Services wired up (Hexagonal Architecture), rate table {}, reports in {}",
                    rateTable.version(), engineConfig.getReportDirectory().toAbsolutePath());
            return Future.succeededFuture();
        } catch (Exception e) {
            log.error("Error initializing services", e);
            return Future.failedFuture(e);
        }
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        WebRouter webRouter = new WebRouter(router, calculationHandler, exportHandler, rateLookupHandler);
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ErrorResponse.send(ctx, 404, ErrorResponse.of("Endpoint not found")));

        int port = engineConfig.getHttpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }
}
