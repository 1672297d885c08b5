package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress / heartbeat logger for long-running conversion runs.
 */
public final class CliProgressMonitor {

    private static final AtomicInteger doneCount = new AtomicInteger(0);
    private static volatile String currentKey = "";

    private CliProgressMonitor() {
    }

    public static void setCurrent(String key, int done) {
        currentKey = (key == null) ? "" : key;
        doneCount.set(Math.max(0, done));
    }

    public static Thread startHeartbeat(int total) {
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(30_000L);
                    System.out.println("[HEARTBEAT] running... " + doneCount.get() + "/" + total + " last=" + currentKey);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "dialect-convert-heartbeat");
        t.setDaemon(true);
        t.start();
        return t;
    }

    /**
     * @param statements statements converted so far, over all finished files
     * @param flagged    of those, statements that need review (flagged or syntax error)
     */
    public static void logProgress(int done, int total, int success, int skip,
                                   int statements, int flagged,
                                   long loopStartNs, String lastKey) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;
        double rate = (statements == 0) ? 0.0 : (statements - flagged) * 100.0 / statements;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        System.out.printf(Locale.ROOT,
                "[PROGRESS] %d/%d files success=%d skip=%d | statements=%d review=%d rate=%.1f%% | elapsed=%dms heap=%d/%dMB last=%s%n",
                done, total, success, skip, statements, flagged, rate, elapsed, usedMb, maxMb, lastKey);
    }
}
