/* (C)2026 */
package com.ammann.trialanalysis.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.trialanalysis.dto.SystemResourcesDTO;
import org.junit.jupiter.api.Test;

class JvmSystemResourceProviderTest {

    @Test
    void usageIsReportedAsPercentages() {
        SystemResourcesDTO usage = new JvmSystemResourceProvider().currentUsage();

        assertThat(usage.cpu()).isBetween(0.0, 100.0);
        assertThat(usage.memory()).isBetween(0.0, 100.0);
        assertThat(usage.disk()).isBetween(0.0, 100.0);
    }
}
