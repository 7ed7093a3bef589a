package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Progress logger for long-running CLI jobs.
 */
public final class CliProgressMonitor {

    private CliProgressMonitor() {
    }

    public static void logProgress(int done, int total, int statements, int unsupported,
                                   long loopStartNs, String lastKey) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        System.out.printf("[PROGRESS] %d/%d statements=%d unsupported=%d elapsed=%dms heap=%d/%dMB last=%s%n",
                done, total, statements, unsupported, elapsed, usedMb, maxMb, lastKey);
    }
}
