package com.dicalc.application.engine;

import com.dicalc.application.engine.mode.CompoundInterestCalculator;
import com.dicalc.application.engine.mode.DelayedInterestCalculator;
import com.dicalc.application.engine.mode.FloatingInterestCalculator;
import com.dicalc.application.engine.mode.PenaltyInterestCalculator;
import com.dicalc.application.engine.mode.SimpleInterestCalculator;
import com.dicalc.application.port.out.RateTableProvider;

import java.util.List;

/**
 * Dispatcher wired with every mode calculator, for tests outside the engine package
 */
public final class TestEngines {

    private TestEngines() {
    }

    public static CalculationModeDispatcher dispatcher(RateTableProvider rateTable) {
        DayCountEngine dayCount = new DayCountEngine();
        return new CalculationModeDispatcher(
                new PeriodSegmenter(rateTable, dayCount),
                new PaymentOffsetAllocator(),
                new RateCapValidator(rateTable, dayCount),
                rateTable,
                List.of(
                        new SimpleInterestCalculator(dayCount),
                        new FloatingInterestCalculator(dayCount),
                        new DelayedInterestCalculator(dayCount),
                        new CompoundInterestCalculator(dayCount),
                        new PenaltyInterestCalculator(dayCount)
                ));
    }
}
