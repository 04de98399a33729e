package com.dicalc.application.service;

import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.application.port.in.InterestCalculationUseCase.CalculationCommand;
import com.dicalc.application.port.in.InterestCalculationUseCase.PaymentCommand;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.CompoundingCycle;
import com.dicalc.domain.model.DayCountBasis;
import com.dicalc.domain.model.DayCountContext;
import com.dicalc.domain.model.Payment;
import com.dicalc.domain.model.PaymentOffsetPolicy;
import com.dicalc.domain.model.PenaltyBasis;
import com.dicalc.domain.model.RateTerm;
import com.dicalc.domain.model.request.CalculationRequest;
import com.dicalc.domain.model.request.CalculationTerms;
import com.dicalc.domain.model.request.CompoundRequest;
import com.dicalc.domain.model.request.DelayedRequest;
import com.dicalc.domain.model.request.FloatingRequest;
import com.dicalc.domain.model.request.PenaltyRequest;
import com.dicalc.domain.model.request.SimpleRequest;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Converts a validated command into the typed request of its mode and fills in defaults:
 * multiplier 1, the term itself as cap term for floating caps, the configured cap for penalties,
 * and the judgment-debt offset order for delayed-performance interest.
 */
@RequiredArgsConstructor
public class CalculationRequestMapper {

    private final DayCountEngine dayCount;
    private final BigDecimal defaultCapMultiplier;
    private final RateTerm defaultCapTerm;

    public CalculationRequest toRequest(CalculationCommand command) {
        CalculationMode mode = CalculationMode.fromValue(command.mode());
        CalculationTerms terms = toTerms(command, mode);

        return switch (mode) {
            case SIMPLE -> new SimpleRequest(terms, command.annualRatePercent(), basis(command));
            case FLOATING -> toFloating(command, terms);
            case DELAYED -> new DelayedRequest(terms);
            case COMPOUND -> new CompoundRequest(terms, command.annualRatePercent(), basis(command),
                    CompoundingCycle.fromValue(command.compoundingCycle()));
            case PENALTY -> toPenalty(command, terms);
        };
    }

    private FloatingRequest toFloating(CalculationCommand command, CalculationTerms terms) {
        RateTerm term = RateTerm.fromValue(command.term());
        RateTerm capTerm = null;
        if (command.capMultiplier() != null) {
            capTerm = command.capTerm() == null ? term : RateTerm.fromValue(command.capTerm());
        }
        return new FloatingRequest(terms, term, multiplierOrOne(command), basis(command),
                command.capMultiplier(), capTerm);
    }

    private PenaltyRequest toPenalty(CalculationCommand command, CalculationTerms terms) {
        PenaltyBasis penaltyBasis = PenaltyBasis.fromValue(command.penaltyBasis());
        RateTerm term = command.term() == null ? null : RateTerm.fromValue(command.term());

        RateTerm capTerm;
        if (command.capTerm() != null) {
            capTerm = RateTerm.fromValue(command.capTerm());
        } else {
            capTerm = penaltyBasis == PenaltyBasis.FLOATING ? term : defaultCapTerm;
        }
        BigDecimal capMultiplier = command.capMultiplier() == null ? defaultCapMultiplier : command.capMultiplier();

        return new PenaltyRequest(
                terms,
                penaltyBasis,
                penaltyBasis == PenaltyBasis.FIXED ? command.annualRatePercent() : null,
                term,
                penaltyBasis == PenaltyBasis.FLOATING ? multiplierOrOne(command) : null,
                basis(command),
                capMultiplier,
                capTerm
        );
    }

    private CalculationTerms toTerms(CalculationCommand command, CalculationMode mode) {
        List<Payment> payments = command.payments() == null
                ? List.of()
                : command.payments().stream().map(this::toPayment).toList();

        PaymentOffsetPolicy policy;
        if (command.paymentOffsetPolicy() != null) {
            policy = PaymentOffsetPolicy.fromValue(command.paymentOffsetPolicy());
        } else {
            policy = mode == CalculationMode.DELAYED ? PaymentOffsetPolicy.JUDGMENT_DEBT : PaymentOffsetPolicy.GENERAL_DEBT;
        }

        return new CalculationTerms(
                command.principal(),
                RequestValidator.parseDate(command.startDate()),
                RequestValidator.parseDate(command.endDate()),
                payments,
                policy,
                command.outstandingCosts(),
                command.priorInterest()
        );
    }

    private Payment toPayment(PaymentCommand payment) {
        return new Payment(RequestValidator.parseDate(payment.date()), payment.amount());
    }

    private DayCountBasis basis(CalculationCommand command) {
        DayCountContext context = command.dayCountContext() == null
                ? null
                : DayCountContext.fromValue(command.dayCountContext());
        return dayCount.resolveBaseDays(command.baseDays(), context);
    }

    private static BigDecimal multiplierOrOne(CalculationCommand command) {
        return command.multiplier() == null ? BigDecimal.ONE : command.multiplier();
    }
}
