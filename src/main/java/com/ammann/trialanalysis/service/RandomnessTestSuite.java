/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.config.AnalysisConfig;
import com.ammann.trialanalysis.dto.AutocorrelationResultDTO;
import com.ammann.trialanalysis.dto.QuickTestResultDTO;
import com.ammann.trialanalysis.dto.RandomnessSuiteResultDTO;
import com.ammann.trialanalysis.dto.RandomnessTestResultDTO;
import com.ammann.trialanalysis.dto.TestBatteryDTO;
import com.ammann.trialanalysis.exception.ValidationException;
import com.ammann.trialanalysis.math.StatisticalMath;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jboss.logging.Logger;

/**
 * Battery of randomness tests over a bit sequence.
 *
 * <p>Bit-level tests follow NIST SP 800-22 (frequency, block frequency, runs, longest run,
 * cumulative sums). Byte-level tests follow the ENT program (entropy, compression,
 * chi-square, serial correlation) on bits packed MSB-first. An autocorrelation scan
 * completes the suite.
 */
@ApplicationScoped
public class RandomnessTestSuite {

    private static final Logger LOG = Logger.getLogger(RandomnessTestSuite.class);

    public static final String FREQUENCY = "frequency";
    public static final String BLOCK_FREQUENCY = "block_frequency";
    public static final String RUNS = "runs";
    public static final String LONGEST_RUN = "longest_run";
    public static final String CUMULATIVE_SUMS = "cumulative_sums";
    public static final String ENTROPY = "entropy";
    public static final String COMPRESSION = "compression";
    public static final String CHI_SQUARE = "chi_square";
    public static final String SERIAL_CORRELATION = "serial_correlation";

    static final double BIT_BATTERY_PASS_RATE = 0.80;
    static final double BYTE_BATTERY_PASS_RATE = 0.75;
    static final double BIT_WEIGHT = 50.0;
    static final double BYTE_WEIGHT = 30.0;
    static final double AUTOCORRELATION_WEIGHT = 20.0;

    static final double MIN_ENTROPY_BITS_PER_BYTE = 7.9;
    static final double MAX_COMPRESSION_RATIO = 0.1;
    static final double MAX_SERIAL_CORRELATION = 0.1;
    static final int MAX_AUTOCORRELATION_LAG = 100;
    static final int[] SAMPLED_LAGS = {1, 5, 10};

    private final AnalysisConfig config;

    @Inject
    public RandomnessTestSuite(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Runs every test on the sequence.
     *
     * @param bits sequence of 0/1 values
     * @return suite result with the weighted overall quality
     * @throws ValidationException if the sequence is empty or holds values other than 0 and 1
     */
    public RandomnessSuiteResultDTO runFullTestSuite(int[] bits) {
        requireBits(bits);
        double alpha = config.randomnessAlpha();

        List<RandomnessTestResultDTO> bitResults = List.of(
                frequencyTest(bits, alpha),
                blockFrequencyTest(bits, config.blockSize(), alpha),
                runsTest(bits, alpha),
                longestRunTest(bits, alpha),
                cumulativeSumsTest(bits, alpha));
        TestBatteryDTO bitBattery = TestBatteryDTO.of("nist", bitResults, BIT_BATTERY_PASS_RATE);

        int[] bytes = packBytes(bits);
        List<RandomnessTestResultDTO> byteResults = List.of(
                entropyTest(bytes),
                compressionTest(bytes),
                chiSquareTest(bytes, alpha),
                serialCorrelationTest(bytes));
        TestBatteryDTO byteBattery = TestBatteryDTO.of("ent", byteResults, BYTE_BATTERY_PASS_RATE);

        AutocorrelationResultDTO autocorrelation =
                autocorrelationTest(bits, config.randomnessAutocorrelationThreshold());

        double overall = overallQuality(bitBattery, byteBattery, autocorrelation);
        LOG.infof("Randomness suite over %d bits: nist=%d/%d ent=%d/%d autocorrelation=%s quality=%.1f",
                bits.length,
                bitBattery.passedCount(), bitResults.size(),
                byteBattery.passedCount(), byteResults.size(),
                autocorrelation.passed() ? "pass" : "fail",
                overall);

        return new RandomnessSuiteResultDTO(
                bitBattery,
                byteBattery,
                autocorrelation,
                overall,
                recommendation(overall),
                bits.length,
                Instant.now());
    }

    /** Monobit test: S = |2·ones − n|, p = erfc(S / sqrt(2n)). */
    public RandomnessTestResultDTO frequencyTest(int[] bits, double alpha) {
        int n = bits.length;
        long ones = countOnes(bits, 0, n);
        double s = Math.abs(2.0 * ones - n);
        double pValue = StatisticalMath.erfc(s / Math.sqrt(2.0 * n));
        return RandomnessTestResultDTO.pValueTest(
                FREQUENCY, s, pValue, alpha,
                String.format(Locale.ROOT, "%d ones in %d bits", ones, n));
    }

    /**
     * Block frequency: χ² = 4M · Σ (π_i − 1/2)² over complete blocks of size M,
     * p = igamc(blocks / 2, χ² / 2).
     */
    public RandomnessTestResultDTO blockFrequencyTest(int[] bits, int blockSize, double alpha) {
        int blocks = bits.length / blockSize;
        if (blocks == 0) {
            return new RandomnessTestResultDTO(
                    BLOCK_FREQUENCY, 0.0, 0.0, false, alpha,
                    "Sequence shorter than one block of " + blockSize + " bits");
        }
        double sum = 0.0;
        for (int b = 0; b < blocks; b++) {
            double pi = (double) countOnes(bits, b * blockSize, (b + 1) * blockSize) / blockSize;
            sum += (pi - 0.5) * (pi - 0.5);
        }
        double chiSquare = 4.0 * blockSize * sum;
        double pValue = StatisticalMath.igamc(blocks / 2.0, chiSquare / 2.0);
        return RandomnessTestResultDTO.pValueTest(
                BLOCK_FREQUENCY, chiSquare, pValue, alpha,
                String.format(Locale.ROOT, "%d blocks of %d bits", blocks, blockSize));
    }

    /**
     * Runs test. Fails outright with p = 0 when the ones proportion is off by 2/sqrt(n) or more,
     * otherwise compares the run count with its mean and variance under independence.
     */
    public RandomnessTestResultDTO runsTest(int[] bits, double alpha) {
        int n = bits.length;
        long ones = countOnes(bits, 0, n);
        double pi = (double) ones / n;
        if (Math.abs(pi - 0.5) >= 2.0 / Math.sqrt(n)) {
            return new RandomnessTestResultDTO(
                    RUNS, 0.0, 0.0, false, alpha,
                    String.format(Locale.ROOT, "Frequency prerequisite failed: proportion %.4f", pi));
        }

        long runs = 1;
        for (int i = 1; i < n; i++) {
            if (bits[i] != bits[i - 1]) {
                runs++;
            }
        }
        long zeros = n - ones;
        double expected = 2.0 * ones * zeros / n + 1.0;
        double variance = (expected - 1.0) * (expected - 2.0) / (n - 1.0);
        double z = StatisticalMath.safeDivide(runs - expected, Math.sqrt(variance));
        double pValue = StatisticalMath.twoTailedNormalP(z);
        return RandomnessTestResultDTO.pValueTest(
                RUNS, runs, pValue, alpha,
                String.format(Locale.ROOT, "%d runs, %.1f expected", runs, expected));
    }

    /** Longest run of equal bits against log2(n), z = (L − log2 n) / sqrt(log2 n). */
    public RandomnessTestResultDTO longestRunTest(int[] bits, double alpha) {
        int n = bits.length;
        int longest = 1;
        int current = 1;
        for (int i = 1; i < n; i++) {
            current = bits[i] == bits[i - 1] ? current + 1 : 1;
            longest = Math.max(longest, current);
        }
        double expected = StatisticalMath.log2(n);
        double z = StatisticalMath.safeDivide(longest - expected, Math.sqrt(expected));
        double pValue = n < 2 ? 1.0 : StatisticalMath.twoTailedNormalP(z);
        return RandomnessTestResultDTO.pValueTest(
                LONGEST_RUN, longest, pValue, alpha,
                String.format(Locale.ROOT, "Longest run %d, %.1f expected", longest, expected));
    }

    /** Forward cumulative sums of ±1-mapped bits with the SP 800-22 p-value for the maximum excursion. */
    public RandomnessTestResultDTO cumulativeSumsTest(int[] bits, double alpha) {
        int n = bits.length;
        long sum = 0;
        long z = 0;
        for (int bit : bits) {
            sum += bit == 1 ? 1 : -1;
            z = Math.max(z, Math.abs(sum));
        }
        double pValue = cusumPValue(z, n);
        return RandomnessTestResultDTO.pValueTest(
                CUMULATIVE_SUMS, z, pValue, alpha,
                String.format(Locale.ROOT, "Maximum partial sum %d", z));
    }

    static double cusumPValue(long z, int n) {
        if (z == 0) {
            return 1.0;
        }
        double sqrtN = Math.sqrt(n);
        double first = 0.0;
        for (long k = (long) Math.floor((-n / (double) z + 1) / 4); k <= (long) Math.floor((n / (double) z - 1) / 4); k++) {
            first += StatisticalMath.normalCdf((4 * k + 1) * z / sqrtN)
                    - StatisticalMath.normalCdf((4 * k - 1) * z / sqrtN);
        }
        double second = 0.0;
        for (long k = (long) Math.floor((-n / (double) z - 3) / 4); k <= (long) Math.floor((n / (double) z - 1) / 4); k++) {
            second += StatisticalMath.normalCdf((4 * k + 3) * z / sqrtN)
                    - StatisticalMath.normalCdf((4 * k + 1) * z / sqrtN);
        }
        double pValue = 1.0 - first + second;
        return Math.max(0.0, Math.min(1.0, pValue));
    }

    /**
     * Lag-k autocovariance divided by the variance at lags 1, 5 and 10, plus a scan over
     * lags up to min(100, n/10) for the strongest correlation.
     */
    public AutocorrelationResultDTO autocorrelationTest(int[] bits, double threshold) {
        double[] values = new double[bits.length];
        for (int i = 0; i < bits.length; i++) {
            values[i] = bits[i];
        }
        double lag1 = lagCorrelation(values, 1);
        double lag5 = lagCorrelation(values, 5);
        double lag10 = lagCorrelation(values, 10);

        int scanned = Math.min(MAX_AUTOCORRELATION_LAG, bits.length / 10);
        int maxLag = 0;
        double maxCorrelation = 0.0;
        for (int lag = 1; lag <= scanned; lag++) {
            double r = lagCorrelation(values, lag);
            if (Math.abs(r) > Math.abs(maxCorrelation)) {
                maxCorrelation = r;
                maxLag = lag;
            }
        }

        boolean passed = Math.abs(lag1) < threshold && Math.abs(lag5) < threshold && Math.abs(lag10) < threshold;
        return new AutocorrelationResultDTO(lag1, lag5, lag10, maxLag, maxCorrelation, scanned, threshold, passed);
    }

    /** Shannon entropy in bits per byte, passing above 7.9. */
    public RandomnessTestResultDTO entropyTest(int[] bytes) {
        double entropy = byteEntropy(bytes);
        return new RandomnessTestResultDTO(
                ENTROPY, entropy, entropy, entropy > MIN_ENTROPY_BITS_PER_BYTE, MIN_ENTROPY_BITS_PER_BYTE,
                String.format(Locale.ROOT, "%.4f bits per byte", entropy));
    }

    /** Compression heuristic 1 − unique/256, passing below 0.1. */
    public RandomnessTestResultDTO compressionTest(int[] bytes) {
        boolean[] seen = new boolean[256];
        int unique = 0;
        for (int b : bytes) {
            if (!seen[b]) {
                seen[b] = true;
                unique++;
            }
        }
        double ratio = 1.0 - unique / 256.0;
        return new RandomnessTestResultDTO(
                COMPRESSION, ratio, ratio, ratio < MAX_COMPRESSION_RATIO, MAX_COMPRESSION_RATIO,
                String.format(Locale.ROOT, "%d distinct byte values", unique));
    }

    /** Chi-square goodness of fit of byte counts to uniform, df = 255. */
    public RandomnessTestResultDTO chiSquareTest(int[] bytes, double alpha) {
        if (bytes.length == 0) {
            return new RandomnessTestResultDTO(CHI_SQUARE, 0.0, 0.0, false, alpha, "No complete bytes");
        }
        long[] counts = byteCounts(bytes);
        double expected = bytes.length / 256.0;
        double chiSquare = 0.0;
        for (long count : counts) {
            double d = count - expected;
            chiSquare += d * d / expected;
        }
        double pValue = StatisticalMath.chiSquarePValue(chiSquare, 255);
        return RandomnessTestResultDTO.pValueTest(
                CHI_SQUARE, chiSquare, pValue, alpha,
                String.format(Locale.ROOT, "Chi-square %.2f over %d bytes", chiSquare, bytes.length));
    }

    /** Lag-1 serial correlation of byte values, passing when |r| stays below 0.1. */
    public RandomnessTestResultDTO serialCorrelationTest(int[] bytes) {
        double[] values = new double[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            values[i] = bytes[i];
        }
        double r = lagCorrelation(values, 1);
        return new RandomnessTestResultDTO(
                SERIAL_CORRELATION, r, Math.abs(r), Math.abs(r) < MAX_SERIAL_CORRELATION, MAX_SERIAL_CORRELATION,
                String.format(Locale.ROOT, "Serial correlation %.5f", r));
    }

    /**
     * Lightweight screen for health checks: starts at 100 and loses 20 for a frequency bias
     * above 0.05, 15 for a run-count deviation above 3·sqrt(expected) and 10 for |lag-1| above 0.1.
     */
    public QuickTestResultDTO runQuickTests(int[] bits) {
        requireBits(bits);
        int n = bits.length;
        long ones = countOnes(bits, 0, n);
        double bias = Math.abs((double) ones / n - 0.5);

        long runs = 1;
        for (int i = 1; i < n; i++) {
            if (bits[i] != bits[i - 1]) {
                runs++;
            }
        }
        double expectedRuns = (n + 1) / 2.0;
        double runsDeviation = Math.abs(runs - expectedRuns);

        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = bits[i];
        }
        double lag1 = lagCorrelation(values, 1);

        double quality = 100.0;
        List<String> issues = new ArrayList<>();
        if (bias > 0.05) {
            quality -= 20;
            issues.add(String.format(Locale.ROOT, "Frequency bias %.4f", bias));
        }
        if (runsDeviation > 3.0 * Math.sqrt(expectedRuns)) {
            quality -= 15;
            issues.add(String.format(Locale.ROOT, "Run count deviates by %.1f", runsDeviation));
        }
        if (Math.abs(lag1) > 0.1) {
            quality -= 10;
            issues.add(String.format(Locale.ROOT, "Lag-1 correlation %.4f", lag1));
        }
        return new QuickTestResultDTO(bias, runsDeviation, lag1, quality, issues);
    }

    static double overallQuality(
            TestBatteryDTO bitBattery, TestBatteryDTO byteBattery, AutocorrelationResultDTO autocorrelation) {
        double threshold = autocorrelation.threshold();
        int passedLags = 0;
        for (double r : new double[] {autocorrelation.lag1(), autocorrelation.lag5(), autocorrelation.lag10()}) {
            if (Math.abs(r) < threshold) {
                passedLags++;
            }
        }
        double autocorrelationRate = passedLags / (double) SAMPLED_LAGS.length;
        return bitBattery.passRate() * BIT_WEIGHT
                + byteBattery.passRate() * BYTE_WEIGHT
                + autocorrelationRate * AUTOCORRELATION_WEIGHT;
    }

    static String recommendation(double overall) {
        if (overall >= 95) return "Excellent randomness quality - suitable for all applications";
        if (overall >= 85) return "Good randomness quality - suitable for most applications";
        if (overall >= 70) return "Acceptable randomness quality - monitor for improvements";
        if (overall >= 50) return "Poor randomness quality - investigation required";
        return "Failed randomness tests - system requires immediate attention";
    }

    /** Packs bits MSB-first into bytes, dropping a trailing partial byte. */
    static int[] packBytes(int[] bits) {
        int[] bytes = new int[bits.length / 8];
        for (int i = 0; i < bytes.length; i++) {
            int value = 0;
            for (int j = 0; j < 8; j++) {
                value = (value << 1) | bits[i * 8 + j];
            }
            bytes[i] = value;
        }
        return bytes;
    }

    static double byteEntropy(int[] bytes) {
        if (bytes.length == 0) {
            return 0.0;
        }
        double entropy = 0.0;
        for (long count : byteCounts(bytes)) {
            if (count > 0) {
                double p = (double) count / bytes.length;
                entropy -= p * StatisticalMath.log2(p);
            }
        }
        return entropy;
    }

    /** Lag-k autocovariance over the overlapping n − k pairs divided by the population variance. */
    static double lagCorrelation(double[] values, int lag) {
        int n = values.length;
        if (lag <= 0 || lag >= n) {
            return 0.0;
        }
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= n;
        double variance = 0.0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        variance /= n;
        double covariance = 0.0;
        for (int i = 0; i < n - lag; i++) {
            covariance += (values[i] - mean) * (values[i + lag] - mean);
        }
        covariance /= n - lag;
        return StatisticalMath.safeDivide(covariance, variance);
    }

    private static long[] byteCounts(int[] bytes) {
        long[] counts = new long[256];
        for (int b : bytes) {
            counts[b]++;
        }
        return counts;
    }

    private static long countOnes(int[] bits, int from, int to) {
        long ones = 0;
        for (int i = from; i < to; i++) {
            ones += bits[i];
        }
        return ones;
    }

    private static void requireBits(int[] bits) {
        if (bits == null || bits.length == 0) {
            throw ValidationException.insufficientData("bits for randomness tests", 1, 0);
        }
        for (int bit : bits) {
            if (bit != 0 && bit != 1) {
                throw ValidationException.invalidParameter("bits", bit, "0 or 1");
            }
        }
    }
}
