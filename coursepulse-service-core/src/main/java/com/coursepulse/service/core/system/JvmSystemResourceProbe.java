package com.coursepulse.service.core.system;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads host resources through the platform MXBean, the default file system's stores and the
 * process table. Pseudo and container overlay file systems are skipped.
 */
public class JvmSystemResourceProbe implements SystemResourceProbe {

    private static final Logger log = LoggerFactory.getLogger(JvmSystemResourceProbe.class);

    private static final Set<String> EXCLUDED_FS_TYPES =
            Set.of("squashfs", "tmpfs", "devtmpfs", "overlay", "proc", "sysfs", "cgroup", "cgroup2", "devpts");
    private static final List<String> EXCLUDED_MOUNT_PREFIXES =
            List.of("/etc/", "/app/", "/run/", "/sys/", "/proc/", "/dev/");
    private static final Path LOADAVG = Path.of("/proc/loadavg");

    private final Clock clock;

    public JvmSystemResourceProbe(Clock clock) {
        this.clock = clock;
    }

    @Override
    public SystemResources snapshot() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        return new SystemResources(cpu(os), memory(os), disks(), processCount(), clock.instant());
    }

    private SystemResources.Cpu cpu(OperatingSystemMXBean os) {
        int cores = Runtime.getRuntime().availableProcessors();
        double usage = 0.0;
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            double load = sun.getCpuLoad();
            usage = load < 0 ? 0.0 : round1(load * 100.0);
        }
        Double[] loads = loadAverages(os);
        // physical cores are not exposed by the JVM
        return new SystemResources.Cpu(usage, cores, cores, loads[0], loads[1], loads[2]);
    }

    private Double[] loadAverages(OperatingSystemMXBean os) {
        if (Files.isReadable(LOADAVG)) {
            try {
                String[] parts = Files.readString(LOADAVG).trim().split("\\s+");
                return new Double[] {
                    round2(Double.parseDouble(parts[0])),
                    round2(Double.parseDouble(parts[1])),
                    round2(Double.parseDouble(parts[2]))
                };
            } catch (IOException | RuntimeException ex) {
                log.debug("Could not read {}", LOADAVG, ex);
            }
        }
        double oneMinute = os.getSystemLoadAverage();
        return new Double[] {oneMinute < 0 ? null : round2(oneMinute), null, null};
    }

    private SystemResources.Memory memory(OperatingSystemMXBean os) {
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            long total = sun.getTotalMemorySize();
            long free = sun.getFreeMemorySize();
            long used = total - free;
            return new SystemResources.Memory(total, free, used, percent(used, total));
        }
        Runtime rt = Runtime.getRuntime();
        long total = rt.maxMemory();
        long used = rt.totalMemory() - rt.freeMemory();
        return new SystemResources.Memory(total, total - used, used, percent(used, total));
    }

    private List<SystemResources.Disk> disks() {
        List<SystemResources.Disk> disks = new ArrayList<>();
        Set<String> seenDevices = new HashSet<>();
        for (FileStore store : FileSystems.getDefault().getFileStores()) {
            if (EXCLUDED_FS_TYPES.contains(store.type())) {
                continue;
            }
            String mountPoint = mountPoint(store);
            if (EXCLUDED_MOUNT_PREFIXES.stream().anyMatch(mountPoint::startsWith)) {
                continue;
            }
            if (!seenDevices.add(store.name())) {
                continue;
            }
            try {
                long total = store.getTotalSpace();
                long free = store.getUsableSpace();
                long used = total - store.getUnallocatedSpace();
                disks.add(new SystemResources.Disk(mountPoint, total, used, free, percent(used, total)));
            } catch (IOException | SecurityException ex) {
                log.debug("Skipping inaccessible file store {}", mountPoint, ex);
            }
        }
        return disks;
    }

    /** Unix file stores render as {@code "<mount point> (<device>)"}. */
    static String mountPoint(FileStore store) {
        String text = store.toString();
        int idx = text.lastIndexOf(" (");
        return idx > 0 ? text.substring(0, idx) : text;
    }

    private static long processCount() {
        return ProcessHandle.allProcesses().count();
    }

    private static double percent(long part, long total) {
        return total <= 0 ? 0.0 : round1(part * 100.0 / total);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
