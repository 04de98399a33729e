package com.dicalc.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of offsetting one payment against the outstanding buckets
 */
@Value
public class AllocationResult {
    OutstandingBalance remaining;
    BigDecimal appliedToCosts;
    BigDecimal appliedToPriorInterest;
    BigDecimal appliedToAccruedInterest;
    BigDecimal appliedToPrincipal;
    BigDecimal unappliedRemainder;

    public BigDecimal getRemainingCosts() {
        return remaining.getCosts();
    }

    public BigDecimal getRemainingInterest() {
        return remaining.getInterest();
    }

    public BigDecimal getRemainingPrincipal() {
        return remaining.getPrincipal();
    }

    public BigDecimal getAppliedToInterest() {
        return appliedToPriorInterest.add(appliedToAccruedInterest);
    }

    public boolean hasUnappliedRemainder() {
        return unappliedRemainder.signum() > 0;
    }
}
