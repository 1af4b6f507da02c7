/* (C)2026 */
package com.ammann.trialanalysis.service;

import com.ammann.trialanalysis.dto.SystemResourcesDTO;
import com.ammann.trialanalysis.port.SystemResourceProvider;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Resource usage as seen from the JVM: system load per processor, heap usage and the
 * usage of the working directory's file store.
 */
@DefaultBean
@ApplicationScoped
public class JvmSystemResourceProvider implements SystemResourceProvider {

    @Override
    public SystemResourcesDTO currentUsage() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        double load = os.getSystemLoadAverage();
        double cpu = load < 0 ? 0.0 : Math.min(100.0, load / os.getAvailableProcessors() * 100.0);

        Runtime runtime = Runtime.getRuntime();
        double usedHeap = runtime.totalMemory() - runtime.freeMemory();
        double memory = usedHeap / runtime.maxMemory() * 100.0;

        File root = new File(".").getAbsoluteFile();
        long total = root.getTotalSpace();
        double disk = total == 0 ? 0.0 : (total - root.getUsableSpace()) * 100.0 / total;

        return new SystemResourcesDTO(cpu, memory, disk);
    }
}
