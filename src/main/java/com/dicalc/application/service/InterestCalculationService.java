package com.dicalc.application.service;

import com.dicalc.application.engine.CalculationModeDispatcher;
import com.dicalc.application.port.in.InterestCalculationUseCase;
import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.request.CalculationRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Application service implementing the interest calculation use case
 */
@Slf4j
@RequiredArgsConstructor
public class InterestCalculationService implements InterestCalculationUseCase {

    private final RequestValidator validator;
    private final CalculationRequestMapper mapper;
    private final CalculationModeDispatcher dispatcher;

    @Override
    public CalculationResult calculate(CalculationCommand command) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Validation failed for {} calculation: {}", command.mode(), validation.errors());
            throw validation.toException();
        }
        return calculate(mapper.toRequest(command));
    }

    @Override
    public CalculationResult calculate(CalculationRequest request) {
        log.debug("Calculating {} interest on {} from {} to {}",
                request.mode(), request.terms().principal(), request.terms().startDate(), request.terms().endDate());
        return dispatcher.dispatch(request);
    }
}
