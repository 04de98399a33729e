package com.dicalc.application.service;

import com.dicalc.application.engine.AuditTrailGenerator;
import com.dicalc.application.port.in.InterestCalculationUseCase;
import com.dicalc.application.port.in.ReportExportUseCase;
import com.dicalc.application.port.out.ReportSection;
import com.dicalc.application.port.out.ReportSink;
import com.dicalc.domain.exception.ValidationException;
import com.dicalc.domain.model.CalculationResult;
import com.dicalc.domain.model.CalculationWarning;
import com.dicalc.domain.model.CapResult;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Calculates, renders the audit trail and appends it as one section of the case report
 */
@Slf4j
@RequiredArgsConstructor
public class ReportExportService implements ReportExportUseCase {

    private static final Pattern CASE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,99}");

    private final InterestCalculationUseCase calculations;
    private final AuditTrailGenerator auditTrail;
    private final ReportSink sink;

    @Override
    public Future<ExportReceipt> export(ExportCommand command) {
        CalculationResult result;
        try {
            validateCaseId(command.caseId());
            if (command.calculation() == null) {
                throw new ValidationException("calculation", "calculation is required");
            }
            result = calculations.calculate(command.calculation());
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        ReportSection section = buildSection(command, result);
        log.info("Exporting {} calculation to report {}", result.getMode(), command.caseId());

        return sink.appendSection(command.caseId(), section)
                .map(sheet -> new ExportReceipt(command.caseId(), sheet, result));
    }

    ReportSection buildSection(ExportCommand command, CalculationResult result) {
        String title = command.creditorName() == null
                ? result.getMode().getValue() + " interest calculation"
                : command.creditorName() + ": " + result.getMode().getValue() + " interest calculation";
        String preferred = command.sheetName() != null ? command.sheetName()
                : command.creditorName() != null ? command.creditorName()
                : result.getMode().getValue();

        ReportSection.ReportSectionBuilder section = ReportSection.builder()
                .title(title)
                .preferredSheetName(preferred);

        if (command.creditorName() != null) {
            section.field(new ReportSection.MetadataField("Creditor", command.creditorName()));
        }
        section.field(new ReportSection.MetadataField("Principal", result.getPrincipal().toPlainString()))
                .field(new ReportSection.MetadataField("Period",
                        result.getStartDate() + " to " + result.getEndDate() + " (" + result.getTotalDays() + " days)"))
                .field(new ReportSection.MetadataField("Mode", result.getMode().getValue()))
                .field(new ReportSection.MetadataField("Rate basis", result.getRateBasis()));
        if (result.getDayCount() != null) {
            section.field(new ReportSection.MetadataField("Base days",
                    result.getDayCount().getBaseDays() + " (" + result.getDayCount().describeSource() + ")"));
        }
        section.field(new ReportSection.MetadataField("Total interest", result.getTotalInterest().toPlainString()));

        CapResult cap = result.getCap();
        if (cap != null) {
            section.field(new ReportSection.MetadataField("Cap limit", cap.getCapLimitTotal().toPlainString()))
                    .field(new ReportSection.MetadataField("Capped total", cap.getCappedTotal().toPlainString()));
        }
        section.field(new ReportSection.MetadataField("Rate table",
                result.getRateTableVersion() + " as of " + result.getRateTableAsOf()));
        if (command.legalCitation() != null) {
            section.field(new ReportSection.MetadataField("Legal basis", command.legalCitation()));
        }
        for (CalculationWarning warning : result.getWarnings()) {
            section.field(new ReportSection.MetadataField("Warning " + warning.code().name(), warning.message()));
        }

        section.summary(new ReportSection.SummaryLine(
                result.getMode().getValue(),
                result.getPrincipal(),
                result.getStartDate(),
                result.getEndDate(),
                result.getTotalDays(),
                result.getTotalInterest(),
                cap == null ? null : cap.getCappedTotal()));

        return section.rows(auditTrail.render(result)).build();
    }

    private void validateCaseId(String caseId) {
        if (caseId == null || !CASE_ID.matcher(caseId).matches()) {
            throw new ValidationException("caseId",
                    "caseId must be 1-100 letters, digits, '-' or '_' and start with a letter or digit");
        }
    }
}
