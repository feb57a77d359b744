package cli;

import java.io.PrintStream;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Progress logger for batch runs.
 */
public final class CliProgressMonitor {

    private CliProgressMonitor() {
    }

    public static boolean shouldLog(int done, int total, int logEvery) {
        int every = Math.max(1, logEvery);
        return done % every == 0 || done == total;
    }

    public static void logProgress(PrintStream log, int done, int total, int success, int fail,
                                   long loopStartNs, String lastKey) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        log.printf("[PROGRESS] %d/%d success=%d fail=%d elapsed=%dms heap=%d/%dMB last=%s%n",
                done, total, success, fail, elapsed, usedMb, maxMb, lastKey);
    }
}
