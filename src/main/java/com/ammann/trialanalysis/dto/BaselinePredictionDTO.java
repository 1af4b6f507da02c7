/* (C)2026 */
package com.ammann.trialanalysis.dto;

/**
 * Linear extrapolation of the next baseline mean.
 *
 * @param predictedMean extrapolated mean
 * @param confidence R² · 100 of the fit
 */
public record BaselinePredictionDTO(double predictedMean, double confidence) {}
