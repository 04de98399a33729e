package com.dicalc.adapter.in.web;

import com.dicalc.domain.exception.CalculationException;
import com.dicalc.domain.exception.ErrorKind;
import com.dicalc.domain.exception.FieldError;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.ext.web.RoutingContext;

import java.util.List;

/**
 * Error body shared by all endpoints, with the mapping from exceptions to HTTP status codes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String status,
        String errorKind,
        String field,
        String message,
        List<ErrorDetail> errors
) {

    public record ErrorDetail(String errorKind, String field, String message) {
    }

    public static ErrorResponse of(String message) {
        return new ErrorResponse("error", null, null, message, null);
    }

    public static ErrorResponse from(Throwable error) {
        if (error instanceof CalculationException calculationError) {
            List<ErrorDetail> details = calculationError.getErrors().stream()
                    .map(ErrorResponse::detail)
                    .toList();
            return new ErrorResponse("error", calculationError.getKind().name(), calculationError.getField(),
                    calculationError.getMessage(), details);
        }
        if (error instanceof DecodeException) {
            return new ErrorResponse("error", ErrorKind.VALIDATION.name(), null,
                    "Invalid request format: " + error.getMessage(), null);
        }
        return of("Internal error: " + error.getMessage());
    }

    public static int statusCode(Throwable error) {
        if (error instanceof CalculationException calculationError) {
            return calculationError.getKind() == ErrorKind.RATE_NOT_FOUND ? 422 : 400;
        }
        if (error instanceof DecodeException) {
            return 400;
        }
        return 500;
    }

    public static void send(RoutingContext context, Throwable error) {
        send(context, statusCode(error), from(error));
    }

    public static void send(RoutingContext context, int statusCode, ErrorResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(response));
    }

    private static ErrorDetail detail(FieldError error) {
        return new ErrorDetail(error.kind().name(), error.field(), error.message());
    }
}
