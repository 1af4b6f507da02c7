/* (C)2026 */
package com.ammann.trialanalysis.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Host resource usage in percent.
 *
 * @param cpu CPU load
 * @param memory used memory
 * @param disk used disk space
 */
@Schema(description = "System resource usage")
public record SystemResourcesDTO(double cpu, double memory, double disk) {

    public static SystemResourcesDTO unknown() {
        return new SystemResourcesDTO(0.0, 0.0, 0.0);
    }
}
