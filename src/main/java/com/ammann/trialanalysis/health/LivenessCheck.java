package com.ammann.trialanalysis.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check that unconditionally reports the analysis engine as alive.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.up("alive");
    }

}
