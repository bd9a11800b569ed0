package io.latmon.core.query;

import io.latmon.core.model.ResourceUsage;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.util.stream.Stream;

/**
 * Host and process resource figures from the platform MXBeans. Values the platform cannot
 * provide are reported as zero (load average as -1).
 */
public final class JvmResourceProbe implements ResourceProbe {
    private static final long MB = 1024L * 1024L;

    @Override
    public ResourceUsage sample() {
        RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        Runtime jvm = Runtime.getRuntime();

        long totalMemory = 0;
        long freeMemory = 0;
        double processCpu = 0.0;
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            totalMemory = extended.getTotalMemorySize() / MB;
            freeMemory = extended.getFreeMemorySize() / MB;
            double load = extended.getProcessCpuLoad();
            processCpu = load < 0 ? 0.0 : Math.round(load * 1000.0) / 10.0;
        }

        return new ResourceUsage(
            runtime.getUptime() / 1000L,
            (jvm.totalMemory() - jvm.freeMemory()) / MB,
            processCpu,
            totalMemory,
            freeMemory,
            os.getAvailableProcessors(),
            os.getSystemLoadAverage(),
            processCount()
        );
    }

    private long processCount() {
        try (Stream<ProcessHandle> processes = ProcessHandle.allProcesses()) {
            return processes.count();
        } catch (SecurityException | UnsupportedOperationException e) {
            return 0L;
        }
    }
}
