package com.dicalc.application.port.out;

import io.vertx.core.Future;

/**
 * Output port for the human-auditable export.
 * Each append writes one whole section; sections already in the report are left untouched.
 */
public interface ReportSink {

    /**
     * Append a section to the named report, creating the report if needed
     * @return Future with the sheet name the section was written under
     */
    Future<String> appendSection(String reportName, ReportSection section);
}
