package com.coursepulse.service.core.system;

import java.time.Instant;
import java.util.List;

/** Host resource snapshot attached to the health report. */
public record SystemResources(Cpu cpu, Memory memory, List<Disk> disks, long processCount, Instant collectedAt) {

    /** Load averages are {@code null} where the platform does not expose them. */
    public record Cpu(
            double usagePercent,
            int coresPhysical,
            int coresLogical,
            Double loadAvg1m,
            Double loadAvg5m,
            Double loadAvg15m) {}

    public record Memory(long totalBytes, long availableBytes, long usedBytes, double usagePercent) {}

    public record Disk(String mountPoint, long totalBytes, long usedBytes, long freeBytes, double usagePercent) {}
}
