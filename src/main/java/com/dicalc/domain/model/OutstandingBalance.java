package com.dicalc.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Amounts owed at one point of a calculation, bucket by bucket.
 * priorInterest is interest already owed at the start date (for a judgment debt, the interest the
 * judgment determined); accruedInterest is what this calculation added since.
 */
@Value
public class OutstandingBalance {
    BigDecimal costs;
    BigDecimal priorInterest;
    BigDecimal accruedInterest;
    BigDecimal principal;

    public BigDecimal getInterest() {
        return priorInterest.add(accruedInterest);
    }

    /**
     * Principal, prior interest and costs: everything a judgment fixed, without interest accrued since
     */
    public BigDecimal judgmentAmount() {
        return principal.add(priorInterest).add(costs);
    }
}
