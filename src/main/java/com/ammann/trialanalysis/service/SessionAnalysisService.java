/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.dto.AnalysisReport;
import com.ammann.trialanalysis.dto.CumulativeResultDTO;
import com.ammann.trialanalysis.dto.EffectSizeResultDTO;
import com.ammann.trialanalysis.dto.NetworkVarianceResultDTO;
import com.ammann.trialanalysis.dto.TrendResultDTO;
import com.ammann.trialanalysis.dto.ZScoreResultDTO;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.model.Trial;
import com.ammann.trialanalysis.port.ReportRepository;
import com.ammann.trialanalysis.port.TrialRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Loads the trials of one session, runs an analysis over them and stores the report.
 */
@ApplicationScoped
public class SessionAnalysisService {

    private static final Logger LOG = Logger.getLogger(SessionAnalysisService.class);

    private final TrialRepository trialRepository;
    private final ReportRepository reportRepository;
    private final NetworkVarianceAnalyzer networkVarianceAnalyzer;
    private final EffectSizeCalculator effectSizeCalculator;
    private final ExcursionDetector excursionDetector;
    private final TrendDetector trendDetector;

    @Inject
    public SessionAnalysisService(
            TrialRepository trialRepository,
            ReportRepository reportRepository,
            NetworkVarianceAnalyzer networkVarianceAnalyzer,
            EffectSizeCalculator effectSizeCalculator,
            ExcursionDetector excursionDetector,
            TrendDetector trendDetector) {
        this.trialRepository = trialRepository;
        this.reportRepository = reportRepository;
        this.networkVarianceAnalyzer = networkVarianceAnalyzer;
        this.effectSizeCalculator = effectSizeCalculator;
        this.excursionDetector = excursionDetector;
        this.trendDetector = trendDetector;
    }

    public NetworkVarianceResultDTO networkVariance(String sessionId) {
        return run(sessionId, networkVarianceAnalyzer::analyze);
    }

    public ZScoreResultDTO zScore(String sessionId) {
        return run(sessionId, networkVarianceAnalyzer::zScore);
    }

    public EffectSizeResultDTO effectSize(String sessionId) {
        return run(sessionId, effectSizeCalculator::calculate);
    }

    public CumulativeResultDTO cumulative(String sessionId) {
        return run(sessionId, excursionDetector::analyze);
    }

    public TrendResultDTO trend(String sessionId) {
        return run(sessionId, trendDetector::analyze);
    }

    private <R extends AnalysisReport> R run(String sessionId, Function<List<Trial>, R> analysis) {
        if (sessionId == null || sessionId.isBlank()) {
            throw ValidationException.invalidParameter("sessionId", sessionId, "a non-blank session id");
        }
        List<Trial> trials = trialRepository.findBySession(sessionId);
        R report = analysis.apply(trials);
        reportRepository.save(report, sessionId);
        LOG.debugf("Stored %s for session %s over %d trials", report.reportKind(), sessionId, trials.size());
        return report;
    }
}
