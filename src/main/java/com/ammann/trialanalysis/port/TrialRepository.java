/* (C)2026 */
package com.ammann.trialanalysis.port;

import com.ammann.trialanalysis.model.Trial;
import java.time.Instant;
import java.util.List;

/**
 * Read access to stored trials. The engine never writes trials.
 */
public interface TrialRepository {

    /**
     * Trials with {@code start <= timestamp < end}, ordered by timestamp then sequence number.
     */
    List<Trial> findInTimeWindow(Instant start, Instant end);

    /**
     * All trials of a session, ordered by sequence number.
     */
    List<Trial> findBySession(String sessionId);
}
