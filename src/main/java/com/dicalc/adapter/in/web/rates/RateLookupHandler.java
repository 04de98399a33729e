package com.dicalc.adapter.in.web.rates;

import com.dicalc.adapter.in.web.ErrorResponse;
import com.dicalc.application.port.in.RateLookupUseCase;
import com.dicalc.application.port.in.RateLookupUseCase.RateQuote;
import com.dicalc.domain.exception.CalculationException;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for rate table queries
 * Handles GET /api/rates/:term?date=YYYY-MM-DD
 */
@Slf4j
@RequiredArgsConstructor
public class RateLookupHandler implements Handler<RoutingContext> {

    private final RateLookupUseCase rateLookupUseCase;

    @Override
    public void handle(RoutingContext context) {
        String term = context.pathParam("term");
        String date = context.queryParams().get("date");

        try {
            RateQuote quote = rateLookupUseCase.lookup(term, date);
            context.response()
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("term", quote.term())
                            .put("date", quote.date().toString())
                            .put("annualRatePercent", quote.annualRatePercent().toPlainString())
                            .put("version", quote.version())
                            .put("asOf", quote.asOf().toString())
                            .encode());
        } catch (CalculationException e) {
            log.warn("Rate lookup for {} on {} rejected: {}", term, date, e.getMessage());
            ErrorResponse.send(context, e);
        }
    }
}
