/* (C)2026 */
package com.ammann.trialanalysis.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that runs calibrations off the request thread.
 *
 * <p>A single async slot is enough: the orchestrator admits at most one calibration at a
 * time and rejects the rest before they reach the executor.
 */
@ApplicationScoped
public class ExecutorProducer {

    /**
     * Produces the named ManagedExecutor used by the calibration orchestrator.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("calibration-executor")
    @ApplicationScoped
    public ManagedExecutor createCalibrationExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(1)
                .maxQueued(1)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
