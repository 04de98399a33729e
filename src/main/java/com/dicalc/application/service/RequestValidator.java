package com.dicalc.application.service;

import com.dicalc.application.engine.DayCountEngine;
import com.dicalc.application.port.in.InterestCalculationUseCase.CalculationCommand;
import com.dicalc.application.port.in.InterestCalculationUseCase.PaymentCommand;
import com.dicalc.domain.exception.ErrorKind;
import com.dicalc.domain.exception.FieldError;
import com.dicalc.domain.model.CalculationMode;
import com.dicalc.domain.model.CompoundingCycle;
import com.dicalc.domain.model.DayCountContext;
import com.dicalc.domain.model.PaymentOffsetPolicy;
import com.dicalc.domain.model.PenaltyBasis;
import com.dicalc.domain.model.RateTerm;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates a calculation command before it is turned into a typed request.
 * <p>
 * Structural errors (missing or malformed fields) are reported as VALIDATION. Fields that a mode needs
 * but did not get, or gets but does not accept, are INVALID_PARAMETER, except a missing compounding
 * cycle which has its own kind.
 */
public class RequestValidator {

    private static final DateTimeFormatter SLASH_DATE = DateTimeFormatter.ofPattern("uuuu/MM/dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999999999.99");

    public ValidationResult validate(CalculationCommand command) {
        List<FieldError> errors = new ArrayList<>();

        validateRequiredFields(command, errors);
        validateDataTypes(command, errors);
        validateEnumValues(command, errors);
        validatePayments(command, errors);
        if (errors.isEmpty()) {
            validateModeParameters(command, errors);
        }

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(errors);
        }
    }

    private void validateRequiredFields(CalculationCommand command, List<FieldError> errors) {
        if (isBlank(command.mode())) {
            errors.add(FieldError.validation("mode", "mode is required"));
        }
        if (command.principal() == null) {
            errors.add(FieldError.validation("principal", "principal is required"));
        }
        if (isBlank(command.startDate())) {
            errors.add(FieldError.validation("startDate", "startDate is required"));
        }
        if (isBlank(command.endDate())) {
            errors.add(FieldError.validation("endDate", "endDate is required"));
        }
    }

    private void validateDataTypes(CalculationCommand command, List<FieldError> errors) {
        if (command.principal() != null) {
            if (command.principal().signum() <= 0) {
                errors.add(FieldError.validation("principal", "principal must be positive"));
            } else if (command.principal().compareTo(MAX_AMOUNT) > 0) {
                errors.add(FieldError.validation("principal", "principal exceeds maximum allowed value"));
            }
        }

        LocalDate start = parseOrReport("startDate", command.startDate(), errors);
        LocalDate end = parseOrReport("endDate", command.endDate(), errors);
        if (start != null && end != null && end.isBefore(start)) {
            errors.add(FieldError.validation("endDate", "endDate must not be before startDate"));
        }

        requireNonNegative("outstandingCosts", command.outstandingCosts(), errors);
        requireNonNegative("priorInterest", command.priorInterest(), errors);

        if (command.annualRatePercent() != null && command.annualRatePercent().signum() < 0) {
            errors.add(FieldError.validation("annualRatePercent", "annualRatePercent must be non-negative"));
        }
        if (command.multiplier() != null && command.multiplier().signum() <= 0) {
            errors.add(FieldError.validation("multiplier", "multiplier must be positive"));
        }
        if (command.capMultiplier() != null && command.capMultiplier().signum() <= 0) {
            errors.add(FieldError.validation("capMultiplier", "capMultiplier must be positive"));
        }
        if (command.baseDays() != null && !DayCountEngine.SUPPORTED_BASE_DAYS.contains(command.baseDays())) {
            errors.add(FieldError.invalidParameter("baseDays", "baseDays must be 360 or 365"));
        }
    }

    private void validateEnumValues(CalculationCommand command, List<FieldError> errors) {
        if (!isBlank(command.mode()) && !CalculationMode.isValid(command.mode())) {
            errors.add(FieldError.validation("mode",
                    "mode must be one of: simple, lpr, delay, compound, penalty"));
        }
        if (command.term() != null && !RateTerm.isValid(command.term())) {
            errors.add(FieldError.validation("term", "term must be either 1y or 5y"));
        }
        if (command.capTerm() != null && !RateTerm.isValid(command.capTerm())) {
            errors.add(FieldError.validation("capTerm", "capTerm must be either 1y or 5y"));
        }
        if (command.dayCountContext() != null && !DayCountContext.isValid(command.dayCountContext())) {
            errors.add(FieldError.validation("dayCountContext",
                    "dayCountContext must be one of: FINANCIAL, JUDICIAL, COMMERCIAL"));
        }
        if (command.compoundingCycle() != null && !CompoundingCycle.isValid(command.compoundingCycle())) {
            errors.add(FieldError.validation("compoundingCycle",
                    "compoundingCycle must be one of: MONTH_END, QUARTER_END, HALF_YEAR_END, YEAR_END"));
        }
        if (command.penaltyBasis() != null && !PenaltyBasis.isValid(command.penaltyBasis())) {
            errors.add(FieldError.validation("penaltyBasis", "penaltyBasis must be either FIXED or FLOATING"));
        }
        if (command.paymentOffsetPolicy() != null && !PaymentOffsetPolicy.isValid(command.paymentOffsetPolicy())) {
            errors.add(FieldError.validation("paymentOffsetPolicy",
                    "paymentOffsetPolicy must be either GENERAL_DEBT or JUDGMENT_DEBT"));
        }
    }

    private void validatePayments(CalculationCommand command, List<FieldError> errors) {
        if (command.payments() == null || command.payments().isEmpty()) {
            return;
        }
        LocalDate start = parseQuietly(command.startDate());
        LocalDate end = parseQuietly(command.endDate());
        LocalDate previous = null;

        for (int i = 0; i < command.payments().size(); i++) {
            PaymentCommand payment = command.payments().get(i);
            String prefix = "payments[" + i + "]";
            if (payment == null) {
                errors.add(FieldError.validation(prefix, "payment must not be null"));
                continue;
            }
            if (payment.amount() == null || payment.amount().signum() <= 0) {
                errors.add(FieldError.validation(prefix + ".amount", "payment amount must be positive"));
            }
            LocalDate date = parseOrReport(prefix + ".date", payment.date(), errors);
            if (date == null) {
                if (isBlank(payment.date())) {
                    errors.add(FieldError.validation(prefix + ".date", "payment date is required"));
                }
                continue;
            }
            if (start != null && end != null && (date.isBefore(start) || date.isAfter(end))) {
                errors.add(new FieldError(ErrorKind.INVALID_PAYMENT_DATE, prefix + ".date",
                        String.format("payment date %s is outside %s to %s", date, start, end)));
            }
            if (previous != null && date.isBefore(previous)) {
                errors.add(new FieldError(ErrorKind.INVALID_PAYMENT_DATE, prefix + ".date",
                        String.format("payment date %s is before the preceding payment on %s", date, previous)));
            }
            previous = date;
        }
    }

    private void validateModeParameters(CalculationCommand command, List<FieldError> errors) {
        CalculationMode mode = CalculationMode.fromValue(command.mode());
        switch (mode) {
            case SIMPLE -> {
                requireParameter(mode, "annualRatePercent", command.annualRatePercent(), errors);
                requireBaseDays(mode, command, errors);
                rejectParameter(mode, "multiplier", command.multiplier(), errors);
                rejectParameter(mode, "term", command.term(), errors);
                rejectParameter(mode, "compoundingCycle", command.compoundingCycle(), errors);
                rejectParameter(mode, "penaltyBasis", command.penaltyBasis(), errors);
                rejectParameter(mode, "capMultiplier", command.capMultiplier(), errors);
                rejectParameter(mode, "capTerm", command.capTerm(), errors);
            }
            case FLOATING -> {
                requireParameter(mode, "term", command.term(), errors);
                requireBaseDays(mode, command, errors);
                rejectParameter(mode, "annualRatePercent", command.annualRatePercent(), errors);
                rejectParameter(mode, "compoundingCycle", command.compoundingCycle(), errors);
                rejectParameter(mode, "penaltyBasis", command.penaltyBasis(), errors);
                if (command.capTerm() != null && command.capMultiplier() == null) {
                    errors.add(FieldError.invalidParameter("capTerm", "capTerm needs capMultiplier"));
                }
            }
            case DELAYED -> {
                rejectParameter(mode, "annualRatePercent", command.annualRatePercent(), errors);
                rejectParameter(mode, "multiplier", command.multiplier(), errors);
                rejectParameter(mode, "term", command.term(), errors);
                rejectParameter(mode, "baseDays", command.baseDays(), errors);
                rejectParameter(mode, "dayCountContext", command.dayCountContext(), errors);
                rejectParameter(mode, "compoundingCycle", command.compoundingCycle(), errors);
                rejectParameter(mode, "penaltyBasis", command.penaltyBasis(), errors);
                rejectParameter(mode, "capMultiplier", command.capMultiplier(), errors);
                rejectParameter(mode, "capTerm", command.capTerm(), errors);
            }
            case COMPOUND -> {
                if (command.compoundingCycle() == null) {
                    errors.add(new FieldError(ErrorKind.MISSING_CYCLE, "compoundingCycle",
                            "compoundingCycle is required for compound interest"));
                }
                requireParameter(mode, "annualRatePercent", command.annualRatePercent(), errors);
                requireBaseDays(mode, command, errors);
                rejectParameter(mode, "multiplier", command.multiplier(), errors);
                rejectParameter(mode, "term", command.term(), errors);
                rejectParameter(mode, "penaltyBasis", command.penaltyBasis(), errors);
                rejectParameter(mode, "capMultiplier", command.capMultiplier(), errors);
                rejectParameter(mode, "capTerm", command.capTerm(), errors);
            }
            case PENALTY -> validatePenalty(command, errors);
        }
    }

    private void validatePenalty(CalculationCommand command, List<FieldError> errors) {
        CalculationMode mode = CalculationMode.PENALTY;
        requireParameter(mode, "penaltyBasis", command.penaltyBasis(), errors);
        requireBaseDays(mode, command, errors);
        rejectParameter(mode, "compoundingCycle", command.compoundingCycle(), errors);
        if (command.penaltyBasis() == null) {
            return;
        }
        if (PenaltyBasis.fromValue(command.penaltyBasis()) == PenaltyBasis.FIXED) {
            requireParameter(mode, "annualRatePercent", command.annualRatePercent(), errors);
            rejectParameter(mode, "term", command.term(), errors);
            rejectParameter(mode, "multiplier", command.multiplier(), errors);
        } else {
            requireParameter(mode, "term", command.term(), errors);
            rejectParameter(mode, "annualRatePercent", command.annualRatePercent(), errors);
        }
    }

    private void requireBaseDays(CalculationMode mode, CalculationCommand command, List<FieldError> errors) {
        if (command.baseDays() == null && command.dayCountContext() == null) {
            errors.add(FieldError.invalidParameter("baseDays",
                    "baseDays or dayCountContext is required for " + mode.getValue() + " interest"));
        }
    }

    private void requireParameter(CalculationMode mode, String field, Object value, List<FieldError> errors) {
        if (value == null) {
            errors.add(FieldError.invalidParameter(field, field + " is required for " + mode.getValue() + " interest"));
        }
    }

    private void rejectParameter(CalculationMode mode, String field, Object value, List<FieldError> errors) {
        if (value != null) {
            errors.add(FieldError.invalidParameter(field, field + " does not apply to " + mode.getValue() + " interest"));
        }
    }

    private void requireNonNegative(String field, BigDecimal value, List<FieldError> errors) {
        if (value != null && value.signum() < 0) {
            errors.add(FieldError.validation(field, field + " must be non-negative"));
        }
    }

    private LocalDate parseOrReport(String field, String value, List<FieldError> errors) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return parseDate(value);
        } catch (DateTimeParseException e) {
            errors.add(FieldError.validation(field, field + " must be in ISO format (YYYY-MM-DD)"));
            return null;
        }
    }

    private LocalDate parseQuietly(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return parseDate(value);
        } catch (DateTimeParseException e) {
            // already reported against the date field itself
            return null;
        }
    }

    /**
     * Parses YYYY-MM-DD, also accepting YYYY/MM/DD
     */
    public static LocalDate parseDate(String value) {
        String trimmed = value.trim();
        if (trimmed.indexOf('/') > 0) {
            return LocalDate.parse(trimmed, SLASH_DATE);
        }
        return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
