/* (C)2026 */
package com.ammann.trialanalysis.persistence;

import com.ammann.trialanalysis.model.Trial;
import com.ammann.trialanalysis.model.TrialRecord;
import com.ammann.trialanalysis.port.TrialRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import java.time.Instant;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Read-only trial access backed by the {@code trials} table.
 */
@ApplicationScoped
public class PanacheTrialRepository implements TrialRepository {

    private static final Logger LOG = Logger.getLogger(PanacheTrialRepository.class);

    @Override
    @Transactional(Transactional.TxType.SUPPORTS)
    public List<Trial> findInTimeWindow(Instant start, Instant end) {
        List<Trial> trials = TrialRecord.findInTimeWindow(start, end).stream()
                .map(TrialRecord::toTrial)
                .toList();
        LOG.debugf("Loaded %d trials in [%s, %s)", trials.size(), start, end);
        return trials;
    }

    @Override
    @Transactional(Transactional.TxType.SUPPORTS)
    public List<Trial> findBySession(String sessionId) {
        List<Trial> trials = TrialRecord.findBySession(sessionId).stream()
                .map(TrialRecord::toTrial)
                .toList();
        LOG.debugf("Loaded %d trials for session %s", trials.size(), sessionId);
        return trials;
    }
}
