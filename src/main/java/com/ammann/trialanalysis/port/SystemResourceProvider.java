/* (C)2026 */
package com.ammann.trialanalysis.port;

import com.ammann.trialanalysis.dto.SystemResourcesDTO;

/** Supplies host resource usage for hardware health checks. */
public interface SystemResourceProvider {

    SystemResourcesDTO currentUsage();
}
