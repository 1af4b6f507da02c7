package com.ammann.trialanalysis.persistence;

import com.ammann.trialanalysis.dto.AnalysisReport;
import com.ammann.trialanalysis.model.AnalysisReportRecord;
import com.ammann.trialanalysis.port.ReportRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.Instant;
import org.jboss.logging.Logger;

/**
 * Stores reports as JSON documents in the {@code analysis_reports} table.
 *
 * <p>A report that cannot be serialized is logged and skipped; report persistence never
 * fails the analysis that produced it.
 */
@ApplicationScoped
public class PanacheReportRepository implements ReportRepository
{
    private static final Logger LOG = Logger.getLogger(PanacheReportRepository.class);

    private final ObjectMapper objectMapper;

    @Inject
    public PanacheReportRepository(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(AnalysisReport report, String sessionId)
    {
        AnalysisReportRecord record = toRecord(report, sessionId);
        if (record == null) {
            return;
        }
        record.persist();
        LOG.debugf("Persisted %s report (session=%s)", record.reportKind, sessionId);
    }

    AnalysisReportRecord toRecord(AnalysisReport report, String sessionId)
    {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize %s report, not persisted", report.reportKind());
            return null;
        }
        AnalysisReportRecord record = new AnalysisReportRecord();
        record.reportKind = report.reportKind();
        record.reportTimestamp = report.timestamp() != null ? report.timestamp() : Instant.now();
        record.sessionId = sessionId;
        record.payload = payload;
        return record;
    }
}
