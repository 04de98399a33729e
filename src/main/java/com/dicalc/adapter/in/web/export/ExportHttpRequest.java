package com.dicalc.adapter.in.web.export;

import com.dicalc.adapter.in.web.calculation.CalculationHttpRequest;
import com.dicalc.application.port.in.ReportExportUseCase.ExportCommand;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for appending a calculation to a case report
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public record ExportHttpRequest(
        String sheetName,
        String creditorName,
        String legalCitation,
        CalculationHttpRequest calculation
) {
    @JsonCreator
    public ExportHttpRequest(
            @JsonProperty("sheetName") String sheetName,
            @JsonProperty("creditorName") String creditorName,
            @JsonProperty("legalCitation") String legalCitation,
            @JsonProperty("calculation") CalculationHttpRequest calculation
    ) {
        this.sheetName = sheetName;
        this.creditorName = creditorName;
        this.legalCitation = legalCitation;
        this.calculation = calculation;
    }

    public ExportCommand toCommand(String caseId) {
        return new ExportCommand(
                caseId,
                sheetName,
                creditorName,
                legalCitation,
                calculation == null ? null : calculation.toCommand()
        );
    }
}
