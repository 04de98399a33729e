package com.dicalc.application.engine;

import com.dicalc.domain.exception.ValidationException;
import com.dicalc.domain.model.AllocationResult;
import com.dicalc.domain.model.OutstandingBalance;
import com.dicalc.domain.model.PaymentOffsetPolicy;

import java.math.BigDecimal;

/**
 * Offsets a payment against outstanding costs, interest and principal.
 * <p>
 * GENERAL_DEBT fills costs, then interest (prior before accrued), then principal. JUDGMENT_DEBT fills
 * the judgment-determined amount first, in the order a judgment lists it (principal, interest the
 * judgment fixed, costs), and only then the delayed-performance interest accrued since. No bucket is
 * ever taken below zero; whatever is left over is returned as the unapplied remainder.
 */
public class PaymentOffsetAllocator {

    /**
     * Offset against three buckets. The interest bucket is interest owed before the calculation
     * started, which for a judgment debt is part of the judgment-determined amount.
     */
    public AllocationResult allocate(
            BigDecimal outstandingCosts,
            BigDecimal outstandingInterest,
            BigDecimal outstandingPrincipal,
            BigDecimal paymentAmount,
            PaymentOffsetPolicy policy
    ) {
        requireNonNegative("outstandingInterest", outstandingInterest);
        return allocate(new OutstandingBalance(outstandingCosts, outstandingInterest, BigDecimal.ZERO, outstandingPrincipal),
                paymentAmount, policy);
    }

    public AllocationResult allocate(OutstandingBalance outstanding, BigDecimal paymentAmount, PaymentOffsetPolicy policy) {
        requireNonNegative("outstandingCosts", outstanding.getCosts());
        requireNonNegative("priorInterest", outstanding.getPriorInterest());
        requireNonNegative("accruedInterest", outstanding.getAccruedInterest());
        requireNonNegative("outstandingPrincipal", outstanding.getPrincipal());
        requireNonNegative("payments.amount", paymentAmount);

        Buckets buckets = new Buckets(paymentAmount);
        BigDecimal toCosts;
        BigDecimal toPrior;
        BigDecimal toAccrued;
        BigDecimal toPrincipal;

        if (policy == PaymentOffsetPolicy.JUDGMENT_DEBT) {
            toPrincipal = buckets.take(outstanding.getPrincipal());
            toPrior = buckets.take(outstanding.getPriorInterest());
            toCosts = buckets.take(outstanding.getCosts());
            toAccrued = buckets.take(outstanding.getAccruedInterest());
        } else {
            toCosts = buckets.take(outstanding.getCosts());
            toPrior = buckets.take(outstanding.getPriorInterest());
            toAccrued = buckets.take(outstanding.getAccruedInterest());
            toPrincipal = buckets.take(outstanding.getPrincipal());
        }

        OutstandingBalance remaining = new OutstandingBalance(
                outstanding.getCosts().subtract(toCosts),
                outstanding.getPriorInterest().subtract(toPrior),
                outstanding.getAccruedInterest().subtract(toAccrued),
                outstanding.getPrincipal().subtract(toPrincipal));

        return new AllocationResult(remaining, toCosts, toPrior, toAccrued, toPrincipal, buckets.left);
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new ValidationException(field, field + " must be a non-negative amount");
        }
    }

    /**
     * What is left of the payment while buckets are filled in order
     */
    private static final class Buckets {
        private BigDecimal left;

        private Buckets(BigDecimal payment) {
            this.left = payment;
        }

        private BigDecimal take(BigDecimal bucket) {
            BigDecimal taken = left.min(bucket);
            left = left.subtract(taken);
            return taken;
        }
    }
}
