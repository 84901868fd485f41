package net.convertcompress.support.concurrency;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Snapshot of the host resources the concurrency heuristic looks at.
 *
 * @param processors available processors
 * @param physicalMemoryBytes total physical memory, or the JVM heap ceiling when unknown
 * @param lowPower host is running in a power saving mode
 * @param pressure current CPU pressure
 */
public record SystemConditions(int processors, long physicalMemoryBytes, boolean lowPower, PressureLevel pressure) {

    public enum PressureLevel {
        NOMINAL,
        MODERATE,
        SEVERE
    }

    /**
     * Reads the current host state from the JVM's management beans. The JVM has no portable
     * power state query, so the caller supplies it.
     */
    public static SystemConditions current(boolean lowPower) {
        Runtime runtime = Runtime.getRuntime();
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        long memory = runtime.maxMemory();
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            memory = extended.getTotalMemorySize();
        }
        int processors = runtime.availableProcessors();
        return new SystemConditions(processors, memory, lowPower, pressureFromLoad(os.getSystemLoadAverage(), processors));
    }

    static PressureLevel pressureFromLoad(double loadAverage, int processors) {
        if (loadAverage < 0 || processors <= 0) {
            return PressureLevel.NOMINAL;
        }
        double perCore = loadAverage / processors;
        if (perCore > 1.5) {
            return PressureLevel.SEVERE;
        }
        if (perCore > 1.0) {
            return PressureLevel.MODERATE;
        }
        return PressureLevel.NOMINAL;
    }
}
