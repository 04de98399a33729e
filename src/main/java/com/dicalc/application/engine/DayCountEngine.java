package com.dicalc.application.engine;

import com.dicalc.domain.exception.InvalidParameterException;
import com.dicalc.domain.exception.ValidationException;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.DayCountContext;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Set;

/**
 * Day counting and annual-to-daily rate conversion.
 * <p>
 * Days are counted inclusive of both ends: a range starting and ending on the same date is one day.
 * This is the governing legal convention and differs from the usual exclusive actual/360 count.
 */
public class DayCountEngine {

    public static final MathContext PRECISION = MathContext.DECIMAL128;
    public static final int CURRENCY_SCALE = 2;
    public static final Set<Integer> SUPPORTED_BASE_DAYS = Set.of(360, 365);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public int daysBetween(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new ValidationException("endDate",
                    String.format("endDate %s is before startDate %s", end, start));
        }
        return Math.toIntExact(ChronoUnit.DAYS.between(start, end) + 1);
    }

    /**
     * annualRatePercent / 100 / baseDays
     */
    public BigDecimal dailyRate(BigDecimal annualRatePercent, int baseDays) {
        requireSupported(baseDays);
        return annualRatePercent.divide(HUNDRED.multiply(BigDecimal.valueOf(baseDays)), PRECISION);
    }

    /**
     * principal × annualRatePercent / 100 / baseDays × days, divided once so terminating results stay exact
     */
    public BigDecimal accrue(BigDecimal principal, BigDecimal annualRatePercent, int baseDays, int days) {
        requireSupported(baseDays);
        return principal.multiply(annualRatePercent)
                .multiply(BigDecimal.valueOf(days))
                .divide(HUNDRED.multiply(BigDecimal.valueOf(baseDays)), PRECISION);
    }

    /**
     * principal × dailyRate × days for modes priced directly by a daily rate
     */
    public BigDecimal accrueDaily(BigDecimal principal, BigDecimal dailyRate, int days) {
        return principal.multiply(dailyRate).multiply(BigDecimal.valueOf(days));
    }

    /**
     * Explicit base days win over the context flag. Neither present is an error: the base is never
     * inferred from the mode, since the same mode is used under both conventions.
     */
    public DayCountBasis resolveBaseDays(Integer explicitBaseDays, DayCountContext context) {
        if (explicitBaseDays != null) {
            requireSupported(explicitBaseDays);
            return DayCountBasis.explicit(explicitBaseDays);
        }
        if (context != null) {
            return DayCountBasis.fromContext(context);
        }
        throw new InvalidParameterException("baseDays", "baseDays or dayCountContext is required");
    }

    public static BigDecimal roundCurrency(BigDecimal amount) {
        return amount.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    private void requireSupported(int baseDays) {
        if (!SUPPORTED_BASE_DAYS.contains(baseDays)) {
            throw new InvalidParameterException("baseDays", "baseDays must be 360 or 365, got " + baseDays);
        }
    }
}
