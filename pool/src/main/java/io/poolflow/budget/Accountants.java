package io.poolflow.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.OptionalLong;

/**
 * Chooses the accountant for a new pool from the platform's capabilities.
 */
public final class Accountants {
    private static final Logger log = LoggerFactory.getLogger(Accountants.class);

    private Accountants() {}

    /**
     * An explicit capacity always yields an enforcing budget. Without one, the free physical memory
     * reported by the JVM becomes the capacity; if the platform does not report it, the pool runs
     * unconstrained.
     */
    public static ResourceAccountant detect(OptionalLong capacityOverride) {
        if (capacityOverride.isPresent()) {
            return new MemoryBudget(capacityOverride.getAsLong());
        }
        OptionalLong free = freePhysicalMemory();
        if (free.isPresent()) {
            log.info("Memory budget detected from platform: {} bytes", free.getAsLong());
            return new MemoryBudget(free.getAsLong());
        }
        log.warn("Platform {} does not report physical memory; admission control is disabled and jobs may oversubscribe memory",
                System.getProperty("os.name"));
        return new UnboundedAccountant();
    }

    static OptionalLong freePhysicalMemory() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            long free = sun.getFreeMemorySize();
            if (free > 0) return OptionalLong.of(free);
        }
        return OptionalLong.empty();
    }
}
