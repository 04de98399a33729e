package com.dicalc.application.port.out;

import com.dicalc.domain.model.AuditRow;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A complete, self-contained report section: request metadata followed by the audit rows,
 * plus the one-line entry it adds to the report's summary
 */
@Value
@Builder
public class ReportSection {
    String title;
    String preferredSheetName;
    @Singular
    List<MetadataField> fields;
    @Singular
    List<AuditRow> rows;
    SummaryLine summary;

    public record MetadataField(String label, String value) {
    }

    /**
     * cappedTotal is null when no cap was checked
     */
    public record SummaryLine(
            String mode,
            BigDecimal principal,
            LocalDate startDate,
            LocalDate endDate,
            int days,
            BigDecimal totalInterest,
            BigDecimal cappedTotal
    ) {
    }
}
