/* (C)2026 */
package com.ammann.trialanalysis.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Bit-level autocorrelation scan.
 *
 * @param lag1 autocorrelation at lag 1
 * @param lag5 autocorrelation at lag 5
 * @param lag10 autocorrelation at lag 10
 * @param maxLag lag with the largest |autocorrelation| in the scan
 * @param maxCorrelation autocorrelation at maxLag
 * @param scannedLags number of lags scanned, min(100, n/10)
 * @param threshold pass threshold for the sampled lags
 * @param passed whether lags 1, 5 and 10 all stay below the threshold
 */
@Schema(description = "Autocorrelation test over lags 1, 5, 10 and a scan")
public record AutocorrelationResultDTO(
        double lag1,
        double lag5,
        double lag10,
        int maxLag,
        double maxCorrelation,
        int scannedLags,
        double threshold,
        boolean passed) {}
