/* (C)2026 */
package com.ammann.trialanalysis.port;

import com.ammann.trialanalysis.model.IntervalSample;
import java.util.List;
import java.util.Map;

/**
 * Optional collaborator that supplies external signals (temperature, humidity, EMI, ...)
 * aligned with calibration intervals.
 */
public interface EnvironmentalSignalProvider {

    /**
     * Returns one value per interval for each named signal. Series shorter than the interval
     * list are compared over their common prefix.
     *
     * @param intervals sampled calibration intervals
     * @return signal name to per-interval values
     */
    Map<String, double[]> signalsFor(List<IntervalSample> intervals);
}
