package com.dicalc.adapter.in.web.export;

import com.dicalc.application.port.in.ReportExportUseCase.ExportReceipt;

import java.math.BigDecimal;

/**
 * DTO for a completed report append
 */
public record ExportResponse(
        String status,
        String report,
        String sheet,
        BigDecimal totalInterest
) {
    public static ExportResponse from(ExportReceipt receipt) {
        return new ExportResponse("success", receipt.report(), receipt.sheet(), receipt.result().getTotalInterest());
    }
}
