package com.dicalc.application.engine;

import com.dicalc.domain.model.AuditRow;
import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.CapResult;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a result into the rows a reviewer needs to redo the arithmetic by hand.
 * Output depends only on the result, so rendering the same result twice gives identical rows.
 */
public class AuditTrailGenerator {

    public List<AuditRow> render(CalculationResult result) {
        CapResult cap = result.getCap();
        List<AuditRow> rows = new ArrayList<>(result.getPeriods().size() + 1);

        for (int i = 0; i < result.getPeriods().size(); i++) {
            PeriodResult periodResult = result.getPeriods().get(i);
            Period period = periodResult.getPeriod();
            rows.add(new AuditRow(
                    AuditRow.RowType.PERIOD,
                    i + 1,
                    period.getStartDate(),
                    period.getEndDate(),
                    period.getDays(),
                    period.getPrincipalBase(),
                    period.getBenchmarkRate(),
                    period.getApplicableRate(),
                    period.getDailyRate(),
                    periodResult.getSubInterest(),
                    cap == null ? null : cap.getPeriodLimits().get(i),
                    periodResult.getFormula(),
                    periodResult.getNote()
            ));
        }

        rows.add(totalRow(result));
        return List.copyOf(rows);
    }

    /**
     * Tab-separated text of the header and every row
     */
    public String renderText(CalculationResult result) {
        StringBuilder text = new StringBuilder(String.join("\t", AuditRow.HEADERS)).append('\n');
        for (AuditRow row : render(result)) {
            text.append(row.cells().stream().collect(Collectors.joining("\t"))).append('\n');
        }
        return text.toString();
    }

    private AuditRow totalRow(CalculationResult result) {
        CapResult cap = result.getCap();
        String formula = String.format("sum of %d period interests = %s, rounded HALF_UP to %s",
                result.getPeriods().size(), Decimals.plain(result.getRawTotal()), result.getTotalInterest().toPlainString());
        String note = null;
        if (cap != null) {
            note = String.format("cap %s LPR x %s: raw %s, limit %s, lower %s",
                    cap.getCapTerm().getValue(), Decimals.plain(cap.getCapMultiplier()),
                    cap.getRawTotal().toPlainString(), cap.getCapLimitTotal().toPlainString(),
                    cap.getCappedTotal().toPlainString());
        }
        BigDecimal capLimit = cap == null ? null : cap.getCapLimitTotal();

        return new AuditRow(
                AuditRow.RowType.TOTAL,
                null,
                result.getStartDate(),
                result.getEndDate(),
                result.getTotalDays(),
                result.getPrincipal(),
                null,
                null,
                null,
                result.getTotalInterest(),
                capLimit,
                formula,
                note
        );
    }
}
