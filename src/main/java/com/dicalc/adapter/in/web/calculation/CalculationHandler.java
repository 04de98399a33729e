package com.dicalc.adapter.in.web.calculation;

import com.dicalc.adapter.in.web.ErrorResponse;
import com.dicalc.application.engine.AuditTrailGenerator;
import com.dicalc.application.port.in.InterestCalculationUseCase;
import com.dicalc.application.port.in.InterestCalculationUseCase.CalculationCommand;
import com.dicalc.domain.model.CalculationResult;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for interest calculation
 * Handles POST /api/calculations
 */
@Slf4j
@RequiredArgsConstructor
public class CalculationHandler implements Handler<RoutingContext> {

    private final InterestCalculationUseCase calculationUseCase;
    private final AuditTrailGenerator auditTrail;

    @Override
    public void handle(RoutingContext context) {
        Buffer body = context.body().buffer();
        if (body == null || body.length() == 0) {
            log.warn("Request body is empty");
            ErrorResponse.send(context, 400, ErrorResponse.of("Request body is required"));
            return;
        }

        CalculationCommand command;
        try {
            command = Json.decodeValue(body, CalculationHttpRequest.class).toCommand();
        } catch (DecodeException e) {
            log.warn("Rejected calculation request body: {}", e.getMessage());
            ErrorResponse.send(context, e);
            return;
        }
        log.info("Received {} calculation request from {} to {}", command.mode(), command.startDate(), command.endDate());

        context.vertx()
                .executeBlocking(() -> {
                    CalculationResult result = calculationUseCase.calculate(command);
                    return CalculationResponse.from(result, auditTrail.render(result));
                }, false)
                .onSuccess(response -> context.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "application/json")
                        .end(Json.encode(response)))
                .onFailure(error -> {
                    if (ErrorResponse.statusCode(error) == 500) {
                        log.error("Calculation failed unexpectedly", error);
                    } else {
                        log.warn("Calculation rejected: {}", error.getMessage());
                    }
                    ErrorResponse.send(context, error);
                });
    }
}
