package com.dicalc.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Audit record of a payment and how it was offset
 */
@Value
public class PaymentAllocation {
    Payment payment;
    PaymentOffsetPolicy policy;
    AllocationResult allocation;

    public LocalDate effectiveFrom() {
        return payment.date().plusDays(1);
    }
}
