/* (C)2026 */
package com.ammann.trialanalysis.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * REST API path constants shared by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Trial-window analysis endpoints
     */
    public static final class Analysis {
        private Analysis() {}

        public static final String BASE = "/analysis";
        public static final String NETWORK_VARIANCE = "/network-variance";
        public static final String Z_SCORE = "/z-score";
        public static final String EFFECT_SIZE = "/effect-size";
        public static final String CUMULATIVE = "/cumulative";
        public static final String TREND = "/trend";
        public static final String QUALITY = "/quality";
    }

    /**
     * Calibration endpoints
     */
    public static final class Calibration {
        private Calibration() {}

        public static final String BASE = "/calibration";
        public static final String STANDARD = "/standard";
        public static final String EXTENDED = "/extended";
        public static final String CANCEL = "/cancel";
        public static final String STATUS = "/status";
        public static final String HEALTH_CHECK = "/health-check";
        public static final String SCHEDULES = "/schedules";
    }
}
