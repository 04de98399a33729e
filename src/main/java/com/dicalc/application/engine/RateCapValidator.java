package com.dicalc.application.engine;

import com.dicalc.application.port.out.RateTableProvider;
import com.dicalc.domain.exception.InvalidParameterException;
import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.CapResult;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.RateTerm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Prices the periods of a result again at capMultiplier times the benchmark and reports the
 * raw total, the cap limit and the lower of the two. The raw figure is never replaced.
 */
@Slf4j
@RequiredArgsConstructor
public class RateCapValidator {

    private final RateTableProvider rateTable;
    private final DayCountEngine dayCount;

    public CapResult cap(CalculationResult result, BigDecimal capMultiplier, RateTerm capTerm) {
        DayCountBasis basis = result.getDayCount();
        if (basis == null) {
            throw new InvalidParameterException("capMultiplier", "a rate cap needs an annual day-count basis");
        }
        if (capMultiplier == null || capMultiplier.signum() <= 0) {
            throw new InvalidParameterException("capMultiplier", "capMultiplier must be positive");
        }

        List<BigDecimal> limits = new ArrayList<>(result.getPeriods().size());
        BigDecimal limitTotal = BigDecimal.ZERO;
        for (PeriodResult periodResult : result.getPeriods()) {
            Period period = periodResult.getPeriod();
            BigDecimal capRate = rateTable.lookup(capTerm, period.getStartDate()).multiply(capMultiplier);
            BigDecimal limit = dayCount.accrue(period.getPrincipalBase(), capRate, basis.getBaseDays(), period.getDays());
            limits.add(limit);
            limitTotal = limitTotal.add(limit);
        }

        BigDecimal rawTotal = DayCountEngine.roundCurrency(result.getRawTotal());
        BigDecimal capLimitTotal = DayCountEngine.roundCurrency(limitTotal);
        BigDecimal cappedTotal = rawTotal.min(capLimitTotal);

        log.debug("Cap check at {} x {}: raw {}, limit {}", capTerm.getValue(), capMultiplier, rawTotal, capLimitTotal);
        return new CapResult(capMultiplier, capTerm, rawTotal, capLimitTotal, cappedTotal, List.copyOf(limits));
    }
}
