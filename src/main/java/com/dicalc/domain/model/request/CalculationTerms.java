package com.dicalc.domain.model.request;

import com.dicalc.domain.model.Payment;
import com.dicalc.domain.model.PaymentOffsetPolicy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Fields every calculation mode shares
 */
public record CalculationTerms(
        BigDecimal principal,
        LocalDate startDate,
        LocalDate endDate,
        List<Payment> payments,
        PaymentOffsetPolicy offsetPolicy,
        BigDecimal outstandingCosts,
        BigDecimal priorInterest
) {
    public CalculationTerms {
        payments = payments == null ? List.of() : List.copyOf(payments);
        outstandingCosts = outstandingCosts == null ? BigDecimal.ZERO : outstandingCosts;
        priorInterest = priorInterest == null ? BigDecimal.ZERO : priorInterest;
    }

    public static CalculationTerms of(BigDecimal principal, LocalDate startDate, LocalDate endDate) {
        return new CalculationTerms(principal, startDate, endDate, List.of(), PaymentOffsetPolicy.GENERAL_DEBT, null, null);
    }

    public CalculationTerms withPayments(List<Payment> newPayments, PaymentOffsetPolicy policy) {
        return new CalculationTerms(principal, startDate, endDate, newPayments, policy, outstandingCosts, priorInterest);
    }

    public CalculationTerms withOpeningBalances(BigDecimal costs, BigDecimal interest) {
        return new CalculationTerms(principal, startDate, endDate, payments, offsetPolicy, costs, interest);
    }
}
