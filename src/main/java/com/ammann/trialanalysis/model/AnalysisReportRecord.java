/* (C)2026 */
package com.ammann.trialanalysis.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * JPA entity holding one persisted analysis report.
 *
 * <p>Reports are write-once. The typed report is stored as its JSON document next to the
 * report kind, so every report variant shares one table.
 */
@Entity
@Table(
        name = "analysis_reports",
        indexes = {
            @Index(name = "idx_report_kind_time", columnList = "report_kind, report_timestamp"),
            @Index(name = "idx_report_session", columnList = "session_id")
        })
public class AnalysisReportRecord extends PanacheEntity {

    /** Simple name of the report record type. */
    @Column(name = "report_kind", nullable = false, length = 64)
    @NotNull
    public String reportKind;

    @Column(name = "report_timestamp", nullable = false)
    @NotNull
    public Instant reportTimestamp;

    /** Session the report was computed for, null for time-window or calibration reports. */
    @Column(name = "session_id", length = 64)
    public String sessionId;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    @NotNull
    public String payload;

    @Column(name = "created_at", nullable = false)
    @NotNull
    public Instant createdAt = Instant.now();
}
