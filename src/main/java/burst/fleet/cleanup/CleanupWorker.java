package burst.fleet.cleanup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs cleanup in the background so a fleet run can return without waiting for termination.
 *
 * A JVM shutdown hook releases every guard that is still armed (for example when the process
 * is stopped mid-run) and then gives in-flight cleanup a bounded grace period to finish.
 */
public class CleanupWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CleanupWorker.class);

    private static CleanupWorker shared;

    private final ExecutorService executor;
    private final Duration gracePeriod;
    private final Set<CleanupGuard> armed = ConcurrentHashMap.newKeySet();
    private final Thread shutdownHook;

    private volatile boolean running = true;

    public CleanupWorker(Duration gracePeriod) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "burst-cleanup-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.gracePeriod = gracePeriod;
        this.shutdownHook = new Thread(this::drain, "burst-cleanup-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    /**
     * Process-wide worker, created on first use.
     */
    public static synchronized CleanupWorker shared(Duration gracePeriod) {
        if (shared == null || !shared.running) {
            shared = new CleanupWorker(gracePeriod);
        }
        return shared;
    }

    void arm(CleanupGuard guard) {
        armed.add(guard);
    }

    void disarm(CleanupGuard guard) {
        armed.remove(guard);
    }

    /**
     * Runs {@code task} in the background, or inline if the worker is already shutting down.
     */
    void submit(Runnable task) {
        try {
            executor.execute(wrapRunnable(task));
        } catch (RejectedExecutionException e) {
            log.warn("Cleanup worker is shut down, running cleanup inline");
            wrapRunnable(task).run();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Releases still-armed guards, then waits up to the grace period for cleanup to finish.
     */
    public void drain() {
        if (!running) {
            return;
        }
        for (CleanupGuard guard : Set.copyOf(armed)) {
            log.warn("Releasing cleanup guard left armed at shutdown");
            guard.close();
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Cleanup did not finish within {}; instances may still be running", gracePeriod);
                executor.shutdownNow();
            } else {
                log.debug("Cleanup worker drained");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        drain();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.trace("JVM already shutting down, hook stays registered");
        }
    }

    private Runnable wrapRunnable(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("cleanup error", e);
            }
        };
    }
}
