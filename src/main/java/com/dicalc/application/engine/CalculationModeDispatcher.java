package com.dicalc.application.engine;

import com.dicalc.application.engine.mode.ModeCalculator;
import com.dicalc.application.port.out.RateTableProvider;
import com.dicalc.domain.model.AllocationResult;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.CalculationWarning;
import com.dicalc.domain.model.OutstandingBalance;
import com.dicalc.domain.model.Payment;
import com.dicalc.domain.model.PaymentAllocation;
import com.dicalc.domain.model.Period;
import com.dicalc.domain.model.PeriodResult;
import com.dicalc.domain.model.RateTerm;
import com.dicalc.domain.model.WarningCode;
import com.dicalc.domain.model.request.CalculationRequest;
import com.dicalc.domain.model.request.CalculationTerms;
import com.dicalc.domain.model.request.FloatingRequest;
import com.dicalc.domain.model.request.PenaltyRequest;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a request through segmentation, the mode's accrual, payment offsets and the cap check.
 * <p>
 * Periods are walked in order. Payments take effect from the day after they are made, so the
 * payments of a date are offset before the period starting on the following day is priced, and
 * that period accrues on what remains of the mode's base. Payments made on the end date are offset
 * after the last period. Nothing is rounded until the total.
 */
@Slf4j
public class CalculationModeDispatcher {

    private final PeriodSegmenter segmenter;
    private final PaymentOffsetAllocator allocator;
    private final RateCapValidator capValidator;
    private final RateTableProvider rateTable;
    private final Map<CalculationMode, ModeCalculator> calculators;

    public CalculationModeDispatcher(
            PeriodSegmenter segmenter,
            PaymentOffsetAllocator allocator,
            RateCapValidator capValidator,
            RateTableProvider rateTable,
            List<ModeCalculator> calculators
    ) {
        this.segmenter = segmenter;
        this.allocator = allocator;
        this.capValidator = capValidator;
        this.rateTable = rateTable;
        this.calculators = new EnumMap<>(CalculationMode.class);
        for (ModeCalculator calculator : calculators) {
            this.calculators.put(calculator.mode(), calculator);
        }
    }

    public CalculationResult dispatch(CalculationRequest request) {
        ModeCalculator calculator = calculators.get(request.mode());
        if (calculator == null) {
            throw new IllegalStateException("No calculator registered for mode " + request.mode());
        }

        CalculationTerms terms = request.terms();
        List<Period> periods = segmenter.segment(request);
        Map<LocalDate, List<Payment>> paymentsByEffectiveDate = groupByEffectiveDate(terms.payments());
        RunningBalance balance = new RunningBalance(terms);

        CalculationResult.CalculationResultBuilder result = CalculationResult.builder()
                .mode(request.mode())
                .principal(terms.principal())
                .startDate(terms.startDate())
                .endDate(terms.endDate())
                .rateBasis(request.rateBasis())
                .dayCount(request.dayCount().orElse(null))
                .rateTableVersion(rateTable.version())
                .rateTableAsOf(rateTable.asOf());

        BigDecimal rawTotal = BigDecimal.ZERO;
        for (Period segment : periods) {
            List<String> paymentNotes = applyPayments(
                    paymentsByEffectiveDate.getOrDefault(segment.getStartDate(), List.of()),
                    terms, balance, result);

            Period period = segment.withPrincipalBase(calculator.accrualBase(balance.snapshot()));
            PeriodResult periodResult = calculator.accrue(period, request);
            for (String note : paymentNotes) {
                periodResult = periodResult.appendNote(note);
            }

            balance.accrue(periodResult.getSubInterest());
            rawTotal = rawTotal.add(periodResult.getSubInterest());

            if (calculator.capitalizesAfter(period, request)) {
                BigDecimal capitalised = balance.capitalise();
                periodResult = periodResult.appendNote("capitalised " + Decimals.plain(capitalised) + " into principal");
            }
            result.period(periodResult);
        }

        List<String> trailing = applyPayments(
                paymentsByEffectiveDate.getOrDefault(terms.endDate().plusDays(1), List.of()),
                terms, balance, result);
        if (!trailing.isEmpty()) {
            log.debug("Offset {} payment(s) made on the end date after the last period", trailing.size());
        }

        for (RateTerm term : request.pricingTerms()) {
            forwardFillWarning(term, terms.endDate()).ifPresent(result::warning);
        }

        CalculationResult calculated = result
                .rawTotal(rawTotal)
                .totalInterest(DayCountEngine.roundCurrency(rawTotal))
                .closingBalance(balance.snapshot())
                .build();

        calculated = applyCap(request, calculated);

        log.info("Calculated {} interest from {} to {}: {} periods, total {}",
                request.mode(), terms.startDate(), terms.endDate(), periods.size(), calculated.getTotalInterest());
        return calculated;
    }

    /**
     * Warns when the range runs past both the snapshot's as-of date and the term's last entry,
     * so the tail is priced at a rate nobody has confirmed
     */
    private Optional<CalculationWarning> forwardFillWarning(RateTerm term, LocalDate endDate) {
        LocalDate lastEntry = rateTable.lastEffectiveDate(term);
        LocalDate horizon = lastEntry.isAfter(rateTable.asOf()) ? lastEntry : rateTable.asOf();
        if (!endDate.isAfter(horizon)) {
            return Optional.empty();
        }
        log.debug("{} rate forward-filled from {} to {}", term.getValue(), lastEntry, endDate);
        return Optional.of(new CalculationWarning(WarningCode.RATE_FORWARD_FILLED, String.format(
                "%s rates after %s carry forward the entry of %s (snapshot %s)",
                term.getValue(), horizon, lastEntry, rateTable.version())));
    }

    private CalculationResult applyCap(CalculationRequest request, CalculationResult result) {
        if (request instanceof PenaltyRequest penalty) {
            return result.toBuilder()
                    .cap(capValidator.cap(result, penalty.capMultiplier(), penalty.capTerm()))
                    .build();
        }
        if (request instanceof FloatingRequest floating && floating.isCapped()) {
            return result.toBuilder()
                    .cap(capValidator.cap(result, floating.capMultiplier(), floating.capTerm()))
                    .build();
        }
        return result;
    }

    private List<String> applyPayments(List<Payment> payments, CalculationTerms terms, RunningBalance balance,
                                       CalculationResult.CalculationResultBuilder result) {
        if (payments.isEmpty()) {
            return List.of();
        }
        List<String> notes = new ArrayList<>(payments.size());
        for (Payment payment : payments) {
            AllocationResult allocation = allocator.allocate(balance.snapshot(), payment.amount(), terms.offsetPolicy());
            balance.apply(allocation);
            result.allocation(new PaymentAllocation(payment, terms.offsetPolicy(), allocation));

            notes.add(String.format("payment %s on %s: costs %s, prior interest %s, interest %s, principal %s",
                    Decimals.plain(payment.amount()), payment.date(),
                    Decimals.plain(allocation.getAppliedToCosts()),
                    Decimals.plain(allocation.getAppliedToPriorInterest()),
                    Decimals.plain(allocation.getAppliedToAccruedInterest()),
                    Decimals.plain(allocation.getAppliedToPrincipal())));

            if (allocation.hasUnappliedRemainder()) {
                log.warn("Payment of {} on {} exceeds the outstanding balance by {}",
                        payment.amount(), payment.date(), allocation.getUnappliedRemainder());
                result.warning(new CalculationWarning(WarningCode.UNAPPLIED_REMAINDER, String.format(
                        "Payment of %s on %s left %s unapplied after every bucket was cleared",
                        Decimals.plain(payment.amount()), payment.date(),
                        Decimals.plain(allocation.getUnappliedRemainder()))));
            }
        }
        return notes;
    }

    private static Map<LocalDate, List<Payment>> groupByEffectiveDate(List<Payment> payments) {
        if (payments.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<LocalDate, List<Payment>> grouped = new LinkedHashMap<>();
        for (Payment payment : payments) {
            grouped.computeIfAbsent(payment.date().plusDays(1), date -> new ArrayList<>()).add(payment);
        }
        return grouped;
    }

    /**
     * Outstanding buckets while walking the periods of one request
     */
    private static final class RunningBalance {
        private BigDecimal costs;
        private BigDecimal priorInterest;
        private BigDecimal accruedInterest = BigDecimal.ZERO;
        private BigDecimal principal;
        // interest accrued since the last capitalisation
        private BigDecimal cycleInterest = BigDecimal.ZERO;

        private RunningBalance(CalculationTerms terms) {
            this.costs = terms.outstandingCosts();
            this.priorInterest = terms.priorInterest();
            this.principal = terms.principal();
        }

        private void accrue(BigDecimal subInterest) {
            accruedInterest = accruedInterest.add(subInterest);
            cycleInterest = cycleInterest.add(subInterest);
        }

        private void apply(AllocationResult allocation) {
            OutstandingBalance remaining = allocation.getRemaining();
            costs = remaining.getCosts();
            priorInterest = remaining.getPriorInterest();
            accruedInterest = remaining.getAccruedInterest();
            principal = remaining.getPrincipal();
        }

        /**
         * Moves the interest of the current cycle into principal, limited to what is still unpaid
         */
        private BigDecimal capitalise() {
            BigDecimal amount = cycleInterest.min(accruedInterest);
            principal = principal.add(amount);
            accruedInterest = accruedInterest.subtract(amount);
            cycleInterest = BigDecimal.ZERO;
            return amount;
        }

        private OutstandingBalance snapshot() {
            return new OutstandingBalance(costs, priorInterest, accruedInterest, principal);
        }
    }
}
