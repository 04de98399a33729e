package com.dicalc.adapter.in.web.calculation;

import com.dicalc.domain.model.AllocationResult;
import com.dicalc.domain.model.AuditRow;
import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.CapResult;
import com.dicalc.domain.model.PaymentAllocation;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO for a calculation result together with its audit rows.
 * Unrounded values travel as plain decimal strings so no digits are lost to JSON doubles.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalculationResponse(
        String status,
        String mode,
        BigDecimal principal,
        String startDate,
        String endDate,
        int totalDays,
        String rateBasis,
        Integer baseDays,
        String baseDaysSource,
        BigDecimal totalInterest,
        String rawTotal,
        CapView cap,
        List<PeriodView> periods,
        List<AllocationView> allocations,
        BalanceView closingBalance,
        List<WarningView> warnings,
        RateTableView rateTable,
        List<String> auditHeaders,
        List<List<String>> auditRows
) {

    public record PeriodView(
            String startDate,
            String endDate,
            int days,
            String principalBase,
            String benchmarkRate,
            String applicableRate,
            String dailyRate,
            String subInterest,
            String formula,
            String note
    ) {
    }

    public record CapView(
            String capMultiplier,
            String capTerm,
            BigDecimal rawTotal,
            BigDecimal capLimitTotal,
            BigDecimal cappedTotal,
            boolean capApplied
    ) {
    }

    public record AllocationView(
            String date,
            String effectiveFrom,
            String amount,
            String policy,
            String appliedToCosts,
            String appliedToPriorInterest,
            String appliedToAccruedInterest,
            String appliedToPrincipal,
            String unappliedRemainder
    ) {
    }

    public record BalanceView(String costs, String priorInterest, String accruedInterest, String interest, String principal) {
    }

    public record WarningView(String code, String message) {
    }

    public record RateTableView(String version, String asOf) {
    }

    public static CalculationResponse from(CalculationResult result, List<AuditRow> rows) {
        return new CalculationResponse(
                "success",
                result.getMode().getValue(),
                result.getPrincipal(),
                result.getStartDate().toString(),
                result.getEndDate().toString(),
                result.getTotalDays(),
                result.getRateBasis(),
                result.getDayCount() == null ? null : result.getDayCount().getBaseDays(),
                result.getDayCount() == null ? null : result.getDayCount().describeSource(),
                result.getTotalInterest(),
                plain(result.getRawTotal()),
                cap(result.getCap()),
                result.getPeriods().stream().map(CalculationResponse::period).toList(),
                result.getAllocations().stream().map(CalculationResponse::allocation).toList(),
                new BalanceView(
                        plain(result.getClosingBalance().getCosts()),
                        plain(result.getClosingBalance().getPriorInterest()),
                        plain(result.getClosingBalance().getAccruedInterest()),
                        plain(result.getClosingBalance().getInterest()),
                        plain(result.getClosingBalance().getPrincipal())),
                result.getWarnings().stream().map(w -> new WarningView(w.code().name(), w.message())).toList(),
                new RateTableView(result.getRateTableVersion(), String.valueOf(result.getRateTableAsOf())),
                AuditRow.HEADERS,
                rows.stream().map(AuditRow::cells).toList()
        );
    }

    private static PeriodView period(PeriodResult periodResult) {
        Period period = periodResult.getPeriod();
        return new PeriodView(
                period.getStartDate().toString(),
                period.getEndDate().toString(),
                period.getDays(),
                plain(period.getPrincipalBase()),
                plain(period.getBenchmarkRate()),
                plain(period.getApplicableRate()),
                plain(period.getDailyRate()),
                plain(periodResult.getSubInterest()),
                periodResult.getFormula(),
                periodResult.getNote()
        );
    }

    private static AllocationView allocation(PaymentAllocation paymentAllocation) {
        AllocationResult allocation = paymentAllocation.getAllocation();
        return new AllocationView(
                paymentAllocation.getPayment().date().toString(),
                paymentAllocation.effectiveFrom().toString(),
                plain(paymentAllocation.getPayment().amount()),
                paymentAllocation.getPolicy().name(),
                plain(allocation.getAppliedToCosts()),
                plain(allocation.getAppliedToPriorInterest()),
                plain(allocation.getAppliedToAccruedInterest()),
                plain(allocation.getAppliedToPrincipal()),
                plain(allocation.getUnappliedRemainder())
        );
    }

    private static CapView cap(CapResult cap) {
        if (cap == null) {
            return null;
        }
        return new CapView(
                plain(cap.getCapMultiplier()),
                cap.getCapTerm().getValue(),
                cap.getRawTotal(),
                cap.getCapLimitTotal(),
                cap.getCappedTotal(),
                cap.isCapApplied()
        );
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }
}
