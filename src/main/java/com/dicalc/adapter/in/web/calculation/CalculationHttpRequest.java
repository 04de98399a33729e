package com.dicalc.adapter.in.web.calculation;

import com.dicalc.application.port.in.InterestCalculationUseCase.CalculationCommand;
import com.dicalc.application.port.in.InterestCalculationUseCase.PaymentCommand;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO for a calculation request. Unknown fields are rejected while decoding.
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public record CalculationHttpRequest(
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
        List<PaymentHttpRequest> payments,
        String paymentOffsetPolicy,
        BigDecimal outstandingCosts,
        BigDecimal priorInterest
) {
    @JsonCreator
    public CalculationHttpRequest(
            @JsonProperty("mode") String mode,
            @JsonProperty("principal") BigDecimal principal,
            @JsonProperty("startDate") String startDate,
            @JsonProperty("endDate") String endDate,
            @JsonProperty("annualRatePercent") BigDecimal annualRatePercent,
            @JsonProperty("multiplier") BigDecimal multiplier,
            @JsonProperty("term") String term,
            @JsonProperty("baseDays") Integer baseDays,
            @JsonProperty("dayCountContext") String dayCountContext,
            @JsonProperty("compoundingCycle") String compoundingCycle,
            @JsonProperty("penaltyBasis") String penaltyBasis,
            @JsonProperty("capMultiplier") BigDecimal capMultiplier,
            @JsonProperty("capTerm") String capTerm,
            @JsonProperty("payments") List<PaymentHttpRequest> payments,
            @JsonProperty("paymentOffsetPolicy") String paymentOffsetPolicy,
            @JsonProperty("outstandingCosts") BigDecimal outstandingCosts,
            @JsonProperty("priorInterest") BigDecimal priorInterest
    ) {
        this.mode = mode;
        this.principal = principal;
        this.startDate = startDate;
        this.endDate = endDate;
        this.annualRatePercent = annualRatePercent;
        this.multiplier = multiplier;
        this.term = term;
        this.baseDays = baseDays;
        this.dayCountContext = dayCountContext;
        this.compoundingCycle = compoundingCycle;
        this.penaltyBasis = penaltyBasis;
        this.capMultiplier = capMultiplier;
        this.capTerm = capTerm;
        this.payments = payments;
        this.paymentOffsetPolicy = paymentOffsetPolicy;
        this.outstandingCosts = outstandingCosts;
        this.priorInterest = priorInterest;
    }

    @JsonIgnoreProperties(ignoreUnknown = false)
    public record PaymentHttpRequest(
            @JsonProperty("date") String date,
            @JsonProperty("amount") BigDecimal amount
    ) {
    }

    public CalculationCommand toCommand() {
        List<PaymentCommand> paymentCommands = payments == null
                ? null
                : payments.stream()
                        .map(p -> p == null ? null : new PaymentCommand(p.date(), p.amount()))
                        .toList();
        return new CalculationCommand(
                mode,
                principal,
                startDate,
                endDate,
                annualRatePercent,
                multiplier,
                term,
                baseDays,
                dayCountContext,
                compoundingCycle,
                penaltyBasis,
                capMultiplier,
                capTerm,
                paymentCommands,
                paymentOffsetPolicy,
                outstandingCosts,
                priorInterest
        );
    }
}
