/* (C)2026 */
package com.ammann.trialanalysis.port;

import com.ammann.trialanalysis.dto.AnalysisReport;

/**
 * Persists immutable analysis reports.
 */
public interface ReportRepository {

    /**
     * Stores a report.
     *
     * @param report finished report
     * @param sessionId session the report belongs to, or null
     */
    void save(AnalysisReport report, String sessionId);

    default void save(AnalysisReport report) {
        save(report, null);
    }
}
