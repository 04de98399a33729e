package com.dicalc.adapter.in.web.export;

import com.dicalc.adapter.in.web.ErrorResponse;
import com.dicalc.application.port.in.ReportExportUseCase;
import com.dicalc.application.port.in.ReportExportUseCase.ExportCommand;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for report export
 * Handles POST /api/reports/:caseId/sections
 */
@Slf4j
@RequiredArgsConstructor
public class ExportHandler implements Handler<RoutingContext> {

    private final ReportExportUseCase exportUseCase;

    @Override
    public void handle(RoutingContext context) {
        String caseId = context.pathParam("caseId");
        Buffer body = context.body().buffer();
        if (body == null || body.length() == 0) {
            ErrorResponse.send(context, 400, ErrorResponse.of("Request body is required"));
            return;
        }

        ExportCommand command;
        try {
            command = Json.decodeValue(body, ExportHttpRequest.class).toCommand(caseId);
        } catch (DecodeException e) {
            log.warn("Rejected export request body for case {}: {}", caseId, e.getMessage());
            ErrorResponse.send(context, e);
            return;
        }

        exportUseCase.export(command)
                .onSuccess(receipt -> {
                    log.info("Case {} report now has sheet '{}'", receipt.report(), receipt.sheet());
                    context.response()
                            .setStatusCode(201)
                            .putHeader("Content-Type", "application/json")
                            .end(Json.encode(ExportResponse.from(receipt)));
                })
                .onFailure(error -> {
                    if (ErrorResponse.statusCode(error) == 500) {
                        log.error("Failed to export calculation for case {}", caseId, error);
                    } else {
                        log.warn("Export for case {} rejected: {}", caseId, error.getMessage());
                    }
                    ErrorResponse.send(context, error);
                });
    }
}
