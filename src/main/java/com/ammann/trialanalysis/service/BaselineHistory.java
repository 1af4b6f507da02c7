/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.dto.BaselinePredictionDTO;
import com.ammann.trialanalysis.dto.BaselineResultDTO;
import com.ammann.trialanalysis.enumeration.BaselineTrend;
import com.ammann.trialanalysis.math.SeriesStatistics;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded history of calibration baselines over bits.
 *
 * <p>Keeps the most recent 100 baselines. Trend and prediction assume bit-level baselines
 * centred on 0.5.
 */
@ApplicationScoped
public class BaselineHistory {

    static final int CAPACITY = 100;
    static final int TREND_WINDOW = 5;
    static final int PREDICTION_WINDOW = 10;
    static final double TREND_SLOPE = 0.001;
    static final double CENTRE = 0.5;

    private final Deque<BaselineResultDTO> baselines = new ArrayDeque<>();

    public synchronized void record(BaselineResultDTO baseline) {
        baselines.addLast(baseline);
        while (baselines.size() > CAPACITY) {
            baselines.removeFirst();
        }
    }

    /** Oldest first. */
    public synchronized List<BaselineResultDTO> getHistory() {
        return List.copyOf(baselines);
    }

    /**
     * Slope of |mean − 0.5| over the last five baselines: rising deviation is degrading,
     * falling deviation is improving.
     */
    public synchronized BaselineTrend getTrend() {
        List<BaselineResultDTO> recent = lastN(TREND_WINDOW);
        if (recent.size() < 2) {
            return BaselineTrend.STABLE;
        }
        double[] index = new double[recent.size()];
        double[] deviation = new double[recent.size()];
        for (int i = 0; i < recent.size(); i++) {
            index[i] = i;
            deviation[i] = Math.abs(recent.get(i).mean() - CENTRE);
        }
        double slope = SeriesStatistics.linearFit(index, deviation).slope();
        if (slope > TREND_SLOPE) return BaselineTrend.DEGRADING;
        if (slope < -TREND_SLOPE) return BaselineTrend.IMPROVING;
        return BaselineTrend.STABLE;
    }

    /**
     * Extrapolates the next mean from the last ten baselines with confidence R²·100.
     * Fewer than three baselines predict 0.5 with confidence 0.
     */
    public synchronized BaselinePredictionDTO predictNextBaseline() {
        List<BaselineResultDTO> recent = lastN(PREDICTION_WINDOW);
        if (recent.size() < 3) {
            return new BaselinePredictionDTO(CENTRE, 0.0);
        }
        double[] index = new double[recent.size()];
        double[] means = new double[recent.size()];
        for (int i = 0; i < recent.size(); i++) {
            index[i] = i;
            means[i] = recent.get(i).mean();
        }
        SeriesStatistics.LinearFit fit = SeriesStatistics.linearFit(index, means);
        return new BaselinePredictionDTO(fit.predict(recent.size()), fit.rSquared() * 100);
    }

    private List<BaselineResultDTO> lastN(int count) {
        List<BaselineResultDTO> all = new ArrayList<>(baselines);
        return all.subList(Math.max(0, all.size() - count), all.size());
    }
}
