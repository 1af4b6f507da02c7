package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.config.CalibrationSettings;
import com.ammann.trialanalysis.dto.AnalysisReport;
import com.ammann.trialanalysis.dto.BaselineResultDTO;
import com.ammann.trialanalysis.dto.CalibrationProgressDTO;
import com.ammann.trialanalysis.dto.CalibrationResultDTO;
import com.ammann.trialanalysis.dto.CalibrationScheduleDTO;
import com.ammann.trialanalysis.dto.ExtendedCalibrationResultDTO;
import com.ammann.trialanalysis.dto.HardwareHealthReportDTO;
import com.ammann.trialanalysis.dto.QuickTestResultDTO;
import com.ammann.trialanalysis.dto.RandomnessSuiteResultDTO;
import com.ammann.trialanalysis.dto.SystemResourcesDTO;
import com.ammann.trialanalysis.enumeration.CalibrationInterval;
import com.ammann.trialanalysis.enumeration.CalibrationPhase;
import com.ammann.trialanalysis.enumeration.CalibrationQuality;
import com.ammann.trialanalysis.enumeration.CalibrationState;
import com.ammann.trialanalysis.enumeration.CalibrationType;
import com.ammann.trialanalysis.exception.ApiException;
import com.ammann.trialanalysis.exception.CalibrationException;
import com.ammann.trialanalysis.exception.ConcurrentCalibrationException;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.math.SeriesStatistics;
import com.ammann.trialanalysis.model.IntervalSample;
import com.ammann.trialanalysis.port.EnvironmentalSignalProvider;
import com.ammann.trialanalysis.port.ReportRepository;
import com.ammann.trialanalysis.port.SystemResourceProvider;
import com.ammann.trialanalysis.port.TrialSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Runs calibrations of the trial source.
 *
 * <p>State machine IDLE → RUNNING → {COMPLETED, CANCELLED, FAILED}. At most one calibration
 * runs per process: a start request while one is running fails synchronously with
 * {@link ConcurrentCalibrationException}. Work runs on the {@code calibration-executor};
 * callers poll {@link #getProgress()} or wait on the returned future.
 *
 * <p>Finished calibrations and health reports are handed to the {@link ReportRepository}; a
 * storage failure is logged and the result is still returned. Calibration schedules live in
 * memory only and are empty after a restart until they are registered again.
 */
@ApplicationScoped
public class CalibrationOrchestrator
{
    private static final Logger LOG = Logger.getLogger(CalibrationOrchestrator.class);

    static final double BASELINE_MEAN_TOLERANCE = 0.01;
    static final double BASELINE_VARIANCE_TOLERANCE = 0.01;
    static final double MIN_PASS_RATE = 80.0;
    static final double DEGRADED_PASS_RATE = 85.0;
    static final double DRIFT_MEAN_TOLERANCE = 0.005;
    static final double MIN_BIT_VARIANCE = 0.24;
    static final double MAX_BIT_VARIANCE = 0.26;
    static final double DRIFT_RECOMMENDATION_THRESHOLD = 0.001;
    static final double PERIODIC_RECOMMENDATION_THRESHOLD = 0.1;
    static final int TIMING_SAMPLES = 100;
    static final double EXPECTED_DRAW_MILLIS = 0.1;
    static final int PROGRESS_STEPS = 10;

    static final String NORMAL_OPERATION = "System operating within normal parameters";

    private final AnalysisConfig config;
    private final RandomnessTestSuite randomnessTestSuite;
    private final BaselineEstimator baselineEstimator;
    private final BaselineHistory baselineHistory;
    private final TrialSource trialSource;
    private final SystemResourceProvider resourceProvider;
    private final EnvironmentalSignalProvider environmentalSignals;
    private final ReportRepository reportRepository;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicReference<CalibrationProgressDTO> progress =
            new AtomicReference<>(CalibrationProgressDTO.idle());
    private final AtomicReference<CalibrationResultDTO> lastResult = new AtomicReference<>();
    private final Map<CalibrationInterval, CalibrationScheduleDTO> schedules =
            new EnumMap<>(CalibrationInterval.class);

    private volatile Counter rejectionCounter;
    private Clock clock = Clock.systemUTC();

    @Inject
    public CalibrationOrchestrator(AnalysisConfig config,
                                   RandomnessTestSuite randomnessTestSuite,
                                   BaselineEstimator baselineEstimator,
                                   BaselineHistory baselineHistory,
                                   TrialSource trialSource,
                                   SystemResourceProvider resourceProvider,
                                   Instance<EnvironmentalSignalProvider> environmentalSignals,
                                   ReportRepository reportRepository,
                                   @Named("calibration-executor") ExecutorService executor,
                                   MeterRegistry meterRegistry)
    {
        this(config, randomnessTestSuite, baselineEstimator, baselineHistory, trialSource, resourceProvider,
                environmentalSignals.isResolvable() ? environmentalSignals.get() : null,
                reportRepository, executor, meterRegistry);
    }

    CalibrationOrchestrator(AnalysisConfig config,
                            RandomnessTestSuite randomnessTestSuite,
                            BaselineEstimator baselineEstimator,
                            BaselineHistory baselineHistory,
                            TrialSource trialSource,
                            SystemResourceProvider resourceProvider,
                            EnvironmentalSignalProvider environmentalSignals,
                            ReportRepository reportRepository,
                            ExecutorService executor,
                            MeterRegistry meterRegistry)
    {
        this.config = config;
        this.randomnessTestSuite = randomnessTestSuite;
        this.baselineEstimator = baselineEstimator;
        this.baselineHistory = baselineHistory;
        this.trialSource = trialSource;
        this.resourceProvider = resourceProvider;
        this.environmentalSignals = environmentalSignals;
        this.reportRepository = reportRepository;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    @PostConstruct
    void initMetrics()
    {
        if (meterRegistry != null && rejectionCounter == null) {
            rejectionCounter = Counter.builder("calibration_rejections_total")
                    .description("Calibration requests rejected because another calibration was running")
                    .register(meterRegistry);
        }
    }

    /** Visible for testing only. */
    void setClock(Clock clock)
    {
        this.clock = clock;
    }

    /**
     * Starts a standard calibration over {@code bits} draws.
     *
     * @param bits number of bits to draw
     * @return future completed with the result, or exceptionally when the run fails
     * @throws ConcurrentCalibrationException if a calibration is already running
     * @throws ValidationException if {@code bits} is not positive
     */
    public CompletableFuture<CalibrationResultDTO> startStandardCalibration(int bits)
    {
        if (bits <= 0) {
            throw ValidationException.invalidParameter("trials", bits, "a positive bit count");
        }
        String id = acquire(CalibrationType.STANDARD);
        return submit(id, CalibrationType.STANDARD, () -> {
            CalibrationResultDTO result = runStandard(id, bits);
            lastResult.set(result);
            store(result);
            return result;
        }, result -> CalibrationState.COMPLETED);
    }

    public CompletableFuture<CalibrationResultDTO> startStandardCalibration()
    {
        return startStandardCalibration(config.calibration().standardBits());
    }

    /**
     * Starts an extended calibration that samples for {@code duration} of wall-clock time.
     * {@link #cancel()} stops it between intervals with a partial result.
     *
     * @throws ConcurrentCalibrationException if a calibration is already running
     * @throws ValidationException if the duration is not positive
     */
    public CompletableFuture<ExtendedCalibrationResultDTO> startExtendedCalibration(Duration duration)
    {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw ValidationException.invalidParameter("duration", duration, "a positive duration");
        }
        String id = acquire(CalibrationType.EXTENDED);
        return submit(id, CalibrationType.EXTENDED, () -> {
            ExtendedCalibrationResultDTO result = runExtended(id, duration);
            lastResult.set(result.calibration());
            store(result);
            return result;
        }, result -> result.cancelled() ? CalibrationState.CANCELLED : CalibrationState.COMPLETED);
    }

    /**
     * Requests cancellation of the running extended calibration.
     *
     * @return false when no calibration is running
     */
    public boolean cancel()
    {
        if (!running.get()) {
            return false;
        }
        cancelRequested.set(true);
        LOG.infof("Cancellation requested for calibration %s", progress.get().calibrationId());
        return true;
    }

    public CalibrationProgressDTO getProgress()
    {
        return progress.get();
    }

    public boolean isRunning()
    {
        return running.get();
    }

    public Optional<CalibrationResultDTO> getLastResult()
    {
        return Optional.ofNullable(lastResult.get());
    }

    /**
     * Samples a small bit count, screens it and combines the outcome with host resource usage.
     */
    public HardwareHealthReportDTO runHealthCheck()
    {
        CalibrationSettings settings = config.calibration();

        long startNanos = System.nanoTime();
        int[] bits = draw(settings.healthCheckBits());
        double elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000.0;
        double rngPerformance = Math.max(0.0, 100.0 - elapsedMillis / 100.0);

        double dataIntegrity = assessDataIntegrity(bits);
        int[] validBits = Arrays.stream(bits).filter(b -> b == 0 || b == 1).toArray();
        QuickTestResultDTO quickTests = validBits.length == 0
                ? new QuickTestResultDTO(0.5, 0.0, 0.0, 0.0, List.of("No valid bits drawn"))
                : randomnessTestSuite.runQuickTests(validBits);
        double timingAccuracy = assessTimingAccuracy();
        SystemResourcesDTO resources = resourceProvider != null
                ? resourceProvider.currentUsage()
                : SystemResourcesDTO.unknown();

        double overall = rngPerformance * 0.2
                + quickTests.quality() * 0.2
                + timingAccuracy * 0.15
                + dataIntegrity * 0.15
                + (100 - resources.cpu()) * 0.1
                + (100 - resources.memory()) * 0.1
                + (100 - resources.disk()) * 0.1;

        List<String> recommendations = new ArrayList<>();
        if (overall < 70) {
            recommendations.add("Overall system health below acceptable threshold");
        }
        if (rngPerformance < 80) {
            recommendations.add("RNG performance degraded - consider system restart");
        }
        if (resources.cpu() > 80) {
            recommendations.add("High CPU usage detected - close unnecessary applications");
        }
        if (resources.memory() > 80) {
            recommendations.add("High memory usage detected - restart may be required");
        }
        if (!quickTests.passed()) {
            recommendations.add("Quick randomness screen failed: " + String.join(", ", quickTests.issues()));
        }

        LOG.infof("Health check: overall=%.1f rng=%.1f quick=%.1f timing=%.1f integrity=%.1f",
                overall, rngPerformance, quickTests.quality(), timingAccuracy, dataIntegrity);
        HardwareHealthReportDTO report = new HardwareHealthReportDTO(
                overall, rngPerformance, quickTests, timingAccuracy, dataIntegrity, resources,
                recommendations, clock.instant());
        store(report);
        return report;
    }

    public synchronized CalibrationScheduleDTO schedule(CalibrationInterval interval)
    {
        CalibrationScheduleDTO entry = new CalibrationScheduleDTO(
                interval, clock.instant().plus(interval.getPeriod()), null);
        schedules.put(interval, entry);
        LOG.infof("Calibration scheduled %s, next due %s", interval, entry.nextDue());
        return entry;
    }

    public synchronized boolean unschedule(CalibrationInterval interval)
    {
        return schedules.remove(interval) != null;
    }

    public synchronized List<CalibrationScheduleDTO> getSchedules()
    {
        return List.copyOf(schedules.values());
    }

    /**
     * Starts a standard calibration for the first due schedule entry. Entries stay due while
     * another calibration is running and are retried on the next check.
     *
     * @return the started calibration, if any
     */
    public synchronized Optional<CompletableFuture<CalibrationResultDTO>> runDueCalibrations()
    {
        Instant now = clock.instant();
        for (CalibrationScheduleDTO entry : schedules.values()) {
            if (!entry.isDue(now)) {
                continue;
            }
            if (running.get()) {
                LOG.debugf("Scheduled %s calibration deferred, another calibration is running", entry.interval());
                return Optional.empty();
            }
            try {
                CompletableFuture<CalibrationResultDTO> future = startStandardCalibration();
                schedules.put(entry.interval(), entry.rescheduled(now));
                return Optional.of(future);
            } catch (ConcurrentCalibrationException e) {
                LOG.debugf("Scheduled %s calibration deferred: %s", entry.interval(), e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    CalibrationResultDTO runStandard(String id, int bits)
    {
        Instant start = clock.instant();
        int[] data = drawWithProgress(bits);

        updateProgress(CalibrationPhase.RUNNING_TESTS, 0);
        RandomnessSuiteResultDTO suite = randomnessTestSuite.runFullTestSuite(data);
        updateProgress(CalibrationPhase.RUNNING_TESTS, 100);

        updateProgress(CalibrationPhase.CALCULATING_BASELINE, 0);
        BaselineResultDTO baseline = baselineEstimator.calculateBaseline(data);
        baselineHistory.record(baseline);
        updateProgress(CalibrationPhase.CALCULATING_BASELINE, 100);

        return buildResult(id, CalibrationType.STANDARD, data.length, start, suite, baseline, List.of());
    }

    ExtendedCalibrationResultDTO runExtended(String id, Duration duration)
    {
        CalibrationSettings settings = config.calibration();
        Instant start = clock.instant();
        Instant end = start.plus(duration);
        Duration pause = duration.dividedBy(100);
        if (pause.compareTo(settings.maxSampleInterval()) > 0) {
            pause = settings.maxSampleInterval();
        }

        List<IntervalSample> samples = new ArrayList<>();
        List<int[]> chunks = new ArrayList<>();
        boolean cancelled = false;

        updateProgress(CalibrationPhase.EXTENDED_COLLECTION, 0);
        do {
            int[] chunk = draw(settings.extendedBitsPerInterval());
            chunks.add(chunk);
            samples.add(IntervalSample.of(clock.instant(), chunk));

            long elapsed = Duration.between(start, clock.instant()).toMillis();
            updateProgress(CalibrationPhase.EXTENDED_COLLECTION, elapsed * 100.0 / duration.toMillis());

            if (cancelRequested.get()) {
                cancelled = true;
                break;
            }
            try {
                Thread.sleep(pause.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warnf("Extended calibration %s interrupted, finishing with partial data", id);
                cancelled = true;
                break;
            }
            if (cancelRequested.get()) {
                cancelled = true;
                break;
            }
        } while (clock.instant().isBefore(end));

        updateProgress(CalibrationPhase.EXTENDED_ANALYSIS, 0);
        int[] data = flatten(chunks);
        RandomnessSuiteResultDTO suite = randomnessTestSuite.runFullTestSuite(data);
        BaselineResultDTO baseline = baselineEstimator.calculateBaseline(data);
        baselineHistory.record(baseline);
        updateProgress(CalibrationPhase.EXTENDED_ANALYSIS, 50);

        double drift = baselineEstimator.calculateLongTermDrift(samples);
        List<Double> periodic = baselineEstimator.detectPeriodicPatterns(samples);

        List<String> extra = new ArrayList<>();
        if (Math.abs(drift) > DRIFT_RECOMMENDATION_THRESHOLD) {
            extra.add(String.format(Locale.ROOT, "Long-term drift detected: %.6f", drift));
        }
        if (periodic.stream().anyMatch(p -> Math.abs(p) > PERIODIC_RECOMMENDATION_THRESHOLD)) {
            extra.add("Periodic patterns detected - investigate timing correlations");
        }
        CalibrationResultDTO calibration =
                buildResult(id, CalibrationType.EXTENDED, data.length, start, suite, baseline, extra);

        Instant now = clock.instant();
        ExtendedCalibrationResultDTO result = new ExtendedCalibrationResultDTO(
                calibration,
                drift,
                periodic,
                baselineEstimator.detectSeasonalPatterns(samples),
                environmentalCorrelations(samples),
                degradationIndicators(calibration.passRate(), baseline),
                samples.size(),
                cancelled,
                now.plus(settings.nextDue()),
                now);
        updateProgress(CalibrationPhase.EXTENDED_ANALYSIS, 100);
        return result;
    }

    CalibrationResultDTO buildResult(String id,
                                     CalibrationType type,
                                     int bits,
                                     Instant start,
                                     RandomnessSuiteResultDTO suite,
                                     BaselineResultDTO baseline,
                                     List<String> extraRecommendations)
    {
        double passRate = suite.passRatePercent();
        double rngHealth = rngHealth(passRate, baseline);
        CalibrationQuality quality = CalibrationQuality.fromScore((passRate + rngHealth) / 2.0);

        List<String> recommendations = new ArrayList<>();
        if (quality.needsRecalibration()) {
            recommendations.add("Consider recalibrating the RNG system");
            recommendations.add("Check for environmental interference");
        }
        if (Math.abs(baseline.mean() - 0.5) >= BASELINE_MEAN_TOLERANCE) {
            recommendations.add("Baseline mean deviation detected - investigate bias sources");
        }
        if (passRate < MIN_PASS_RATE) {
            recommendations.add("Multiple randomness tests failed - system validation required");
        }
        recommendations.addAll(extraRecommendations);
        if (recommendations.isEmpty()) {
            recommendations.add(NORMAL_OPERATION);
        }

        Instant now = clock.instant();
        return new CalibrationResultDTO(
                id, type, bits, Duration.between(start, now).toMillis(), rngHealth, passRate, suite, baseline,
                quality, recommendations, now);
    }

    /** passRate · 0.6 plus mean and variance quality (100 within tolerance, else 80) weighted 0.2 each. */
    static double rngHealth(double passRate, BaselineResultDTO baseline)
    {
        double meanQuality = Math.abs(baseline.mean() - 0.5) < BASELINE_MEAN_TOLERANCE ? 100 : 80;
        double varianceQuality = Math.abs(baseline.variance() - 0.25) < BASELINE_VARIANCE_TOLERANCE ? 100 : 80;
        return passRate * 0.6 + meanQuality * 0.2 + varianceQuality * 0.2;
    }

    static List<String> degradationIndicators(double passRate, BaselineResultDTO baseline)
    {
        List<String> indicators = new ArrayList<>();
        if (passRate < DEGRADED_PASS_RATE) {
            indicators.add("Declining test pass rate");
        }
        if (Math.abs(baseline.mean() - 0.5) > DRIFT_MEAN_TOLERANCE) {
            indicators.add("Baseline drift detected");
        }
        if (baseline.variance() < MIN_BIT_VARIANCE || baseline.variance() > MAX_BIT_VARIANCE) {
            indicators.add("Variance outside normal range");
        }
        return indicators;
    }

    /** Pearson correlation of interval means with each external signal; empty on provider failure. */
    Map<String, Double> environmentalCorrelations(List<IntervalSample> samples)
    {
        Map<String, Double> correlations = new LinkedHashMap<>();
        if (environmentalSignals == null) {
            return correlations;
        }
        try {
            double[] means = samples.stream().mapToDouble(IntervalSample::mean).toArray();
            Map<String, double[]> signals = environmentalSignals.signalsFor(samples);
            if (signals == null) {
                return correlations;
            }
            signals.forEach((name, values) -> correlations.put(name, SeriesStatistics.pearson(means, values)));
            return correlations;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Environmental correlation analysis failed, continuing without it");
            return new LinkedHashMap<>();
        }
    }

    static double assessDataIntegrity(int[] bits)
    {
        if (bits.length == 0) {
            return 0.0;
        }
        long invalid = 0;
        long ones = 0;
        for (int bit : bits) {
            if (bit != 0 && bit != 1) {
                invalid++;
            } else if (bit == 1) {
                ones++;
            }
        }
        long zeros = bits.length - invalid - ones;
        if (ones == bits.length || zeros == bits.length) {
            return 0.0;
        }
        return Math.max(0.0, 100.0 - invalid * 100.0 / bits.length);
    }

    private double assessTimingAccuracy()
    {
        double totalDeviation = 0.0;
        for (int i = 0; i < TIMING_SAMPLES; i++) {
            long start = System.nanoTime();
            draw(1);
            double elapsedMillis = (System.nanoTime() - start) / 1_000_000.0;
            totalDeviation += Math.abs(elapsedMillis - EXPECTED_DRAW_MILLIS);
        }
        return Math.max(0.0, 100.0 - totalDeviation / TIMING_SAMPLES * 100.0);
    }

    private String acquire(CalibrationType type)
    {
        if (!running.compareAndSet(false, true)) {
            if (rejectionCounter != null) {
                rejectionCounter.increment();
            }
            String active = progress.get().calibrationId();
            LOG.warnf("Rejected %s calibration request, calibration %s is running", type, active);
            throw new ConcurrentCalibrationException(active);
        }
        String id = UUID.randomUUID().toString();
        Instant now = clock.instant();
        cancelRequested.set(false);
        progress.set(new CalibrationProgressDTO(
                id, type, CalibrationState.RUNNING, CalibrationPhase.PENDING, 0.0, now, now, null));
        LOG.infof("Calibration %s (%s) started", id, type);
        return id;
    }

    private <T> CompletableFuture<T> submit(String id,
                                            CalibrationType type,
                                            Supplier<T> body,
                                            Function<T, CalibrationState> finalState)
    {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    T result = body.get();
                    CalibrationState state = finalState.apply(result);
                    progress.updateAndGet(p -> p.finish(state, null));
                    recordRun(type, state);
                    LOG.infof("Calibration %s (%s) finished: %s", id, type, state);
                    return result;
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Calibration %s (%s) failed", id, type);
                    progress.updateAndGet(p -> p.finish(CalibrationState.FAILED, e.getMessage()));
                    recordRun(type, CalibrationState.FAILED);
                    if (e instanceof ApiException) {
                        throw e;
                    }
                    throw new CalibrationException("Calibration " + id + " failed: " + e.getMessage(), e);
                } finally {
                    running.set(false);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            progress.updateAndGet(p -> p.finish(CalibrationState.FAILED, "Calibration executor rejected the task"));
            running.set(false);
            throw new CalibrationException("Calibration executor rejected calibration " + id, e);
        }
    }

    private void store(AnalysisReport report)
    {
        if (reportRepository == null) {
            return;
        }
        try {
            reportRepository.save(report);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to store %s report, result kept in memory only", report.reportKind());
        }
    }

    private void recordRun(CalibrationType type, CalibrationState state)
    {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("calibration_runs_total")
                .description("Count of finished calibrations")
                .tag("type", type.name().toLowerCase(Locale.ROOT))
                .tag("outcome", state.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    private void updateProgress(CalibrationPhase phase, double percent)
    {
        progress.updateAndGet(p -> p.at(phase, percent));
    }

    private int[] drawWithProgress(int bits)
    {
        updateProgress(CalibrationPhase.GENERATING_DATA, 0);
        int[] data = new int[bits];
        int chunk = Math.max(1, bits / PROGRESS_STEPS);
        for (int offset = 0; offset < bits; offset += chunk) {
            int length = Math.min(chunk, bits - offset);
            System.arraycopy(draw(length), 0, data, offset, length);
            updateProgress(CalibrationPhase.GENERATING_DATA, (offset + length) * 100.0 / bits);
        }
        return data;
    }

    private int[] draw(int count)
    {
        try {
            return trialSource.nextBits(count);
        } catch (ApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalibrationException("Trial source failed: " + e.getMessage(), e);
        }
    }

    private static int[] flatten(List<int[]> chunks)
    {
        int total = chunks.stream().mapToInt(c -> c.length).sum();
        int[] data = new int[total];
        int offset = 0;
        for (int[] chunk : chunks) {
            System.arraycopy(chunk, 0, data, offset, chunk.length);
            offset += chunk.length;
        }
        return data;
    }
}
