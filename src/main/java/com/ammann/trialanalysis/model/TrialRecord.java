package com.ammann.trialanalysis.model;

import com.ammann.trialanalysis.enumeration.ExperimentMode;
import com.ammann.trialanalysis.enumeration.Intention;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * Stored trial row. The engine only reads this table; rows are written by the trial
 * source's own persistence layer.
 */
@Entity
@Table(name = TrialRecord.TABLE_NAME, indexes = {
        @Index(name = "idx_trial_timestamp", columnList = "trial_timestamp"),
        @Index(name = "idx_trial_session", columnList = "session_id, sequence_number")
})
public class TrialRecord extends PanacheEntity
{
    public static final String TABLE_NAME = "trials";

    @Column(name = "trial_timestamp", nullable = false)
    @NotNull
    public Instant timestamp;

    /**
     * Number of ones among the N draws of this trial.
     */
    @Column(name = "trial_value", nullable = false)
    @NotNull
    @Min(value = 0, message = "Trial value must be non-negative")
    public Integer value;

    @Column(name = "session_id", nullable = false, length = 64)
    @NotNull
    public String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "experiment_mode", length = 16)
    public ExperimentMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "intention", length = 16)
    public Intention intention;

    @Column(name = "sequence_number", nullable = false)
    @NotNull
    @Min(value = 0, message = "Sequence number must be non-negative")
    public Long sequenceNumber;

    public Trial toTrial()
    {
        return new Trial(timestamp, value, sessionId, mode, intention, sequenceNumber);
    }

    public static TrialRecord from(Trial trial)
    {
        TrialRecord record = new TrialRecord();
        record.timestamp = trial.timestamp();
        record.value = trial.value();
        record.sessionId = trial.sessionId();
        record.mode = trial.mode();
        record.intention = trial.intention();
        record.sequenceNumber = trial.sequenceNumber();
        return record;
    }

    /**
     * Finds trials in the half-open window [start, end), ordered by timestamp then sequence.
     */
    public static List<TrialRecord> findInTimeWindow(Instant start, Instant end)
    {
        return find("timestamp >= ?1 AND timestamp < ?2 ORDER BY timestamp, sequenceNumber", start, end).list();
    }

    public static List<TrialRecord> findBySession(String sessionId)
    {
        return find("sessionId = ?1 ORDER BY sequenceNumber, timestamp", sessionId).list();
    }
}
