package com.dicalc.application.port.in;

import com.dicalc.application.port.in.InterestCalculationUseCase.CalculationCommand;
import com.dicalc.domain.model.CalculationResult;
import io.vertx.core.Future;

/**
 * Input port for appending calculations to a case workbook
 */
public interface ReportExportUseCase {

    /**
     * Calculate and append the audit trail as a new section of the case report
     * @return Future with the report name, sheet name and the result written
     */
    Future<ExportReceipt> export(ExportCommand command);

    record ExportCommand(
            String caseId,
            String sheetName,
            String creditorName,
            String legalCitation,
            CalculationCommand calculation
    ) {}

    record ExportReceipt(String report, String sheet, CalculationResult result) {}
}
