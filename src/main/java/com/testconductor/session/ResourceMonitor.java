package com.testconductor.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.OptionalDouble;

/**
 * Reports whether the host is under memory pressure, so the session manager
 * can clean up stray browsers before starting another one.
 *
 * A failed measurement is never treated as pressure.
 */
public class ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private final int thresholdPercent;

    public ResourceMonitor(int thresholdPercent) {
        this.thresholdPercent = thresholdPercent;
    }

    public boolean isUnderPressure() {
        OptionalDouble usage = memoryUsagePercent();
        if (usage.isEmpty()) return false;
        double pct = usage.getAsDouble();
        log.info("ResourceMonitor: System memory {}% used", String.format("%.1f", pct));
        if (pct > thresholdPercent) {
            log.warn("ResourceMonitor: Memory use {}% exceeds threshold {}%", String.format("%.1f", pct), thresholdPercent);
            return true;
        }
        return false;
    }

    public int getThresholdPercent() { return thresholdPercent; }

    protected OptionalDouble memoryUsagePercent() {
        try {
            OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
            if (os instanceof com.sun.management.OperatingSystemMXBean platform) {
                long total = platform.getTotalMemorySize();
                long free  = platform.getFreeMemorySize();
                if (total > 0) {
                    return OptionalDouble.of(100.0 * (total - free) / total);
                }
            }
        } catch (Exception e) {
            log.warn("ResourceMonitor: Could not read system memory: {}", e.getMessage());
        }
        return OptionalDouble.empty();
    }
}
