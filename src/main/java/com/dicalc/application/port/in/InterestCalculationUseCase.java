package com.dicalc.application.port.in;

import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.request.CalculationRequest;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input port for interest calculation.
 * Synchronous and pure: one request in, one result out, or an exception before any result exists.
 */
public interface InterestCalculationUseCase {

    /**
     * Validate a raw command, then calculate
     * @throws com.dicalc.domain.exception.CalculationException on any rejected field
     */
    CalculationResult calculate(CalculationCommand command);

    /**
     * Calculate an already typed request
     */
    CalculationResult calculate(CalculationRequest request);

    /**
     * Command object for a calculation, as received from a transport
     */
    record CalculationCommand(
            String mode,
            BigDecimal principal,
            String startDate,
            String endDate,
            BigDecimal annualRatePercent,
            BigDecimal multiplier,
            String term,
            Integer baseDays,
            String dayCountContext,
            String compoundingCycle,
            String penaltyBasis,
            BigDecimal capMultiplier,
            String capTerm,
            List<PaymentCommand> payments,
            String paymentOffsetPolicy,
            BigDecimal outstandingCosts,
            BigDecimal priorInterest
    ) {}

    record PaymentCommand(String date, BigDecimal amount) {}
}
