package burst.fleet.cleanup;

import burst.testing.FakeControlPlane;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CleanupWorkerTest {

    private static final Logger log = LoggerFactory.getLogger(CleanupWorkerTest.class);

    @Test
    void drainReleasesArmedGuards() {
        FakeControlPlane cp = new FakeControlPlane();
        CleanupWorker worker = new CleanupWorker(Duration.ofSeconds(5));
        CleanupGuard guard = new CleanupGuard(cp, worker, Duration.ofMillis(1), Duration.ofMillis(2), log);
        guard.track(List.of("i-1", "i-2"));

        worker.close();

        assertTrue(guard.isReleased());
        assertTrue(guard.completion().isDone());
        assertEquals(List.of(List.of("i-1", "i-2")), cp.terminateCalls);
        assertFalse(worker.isRunning());
    }

    @Test
    void releasedGuardIsNotReleasedAgain() {
        FakeControlPlane cp = new FakeControlPlane();
        CleanupWorker worker = new CleanupWorker(Duration.ofSeconds(5));
        CleanupGuard guard = new CleanupGuard(cp, worker, Duration.ofMillis(1), Duration.ofMillis(2), log);
        guard.track(List.of("i-1"));
        guard.close();

        worker.close();

        assertEquals(1, cp.terminateCalls.size());
    }

    @Test
    void runsInlineAfterShutdown() {
        CleanupWorker worker = new CleanupWorker(Duration.ofSeconds(1));
        worker.close();
        AtomicBoolean ran = new AtomicBoolean();

        worker.submit(() -> ran.set(true));

        assertTrue(ran.get());
    }

    @Test
    void taskFailureIsContained() {
        CleanupWorker worker = new CleanupWorker(Duration.ofSeconds(1));
        worker.close();

        assertDoesNotThrow(() -> worker.submit(() -> {
            throw new IllegalStateException("boom");
        }));
    }

    @Test
    void sharedWorkerIsReplacedOnceDrained() {
        CleanupWorker first = CleanupWorker.shared(Duration.ofSeconds(1));
        assertSame(first, CleanupWorker.shared(Duration.ofSeconds(1)));

        first.close();

        CleanupWorker second = CleanupWorker.shared(Duration.ofSeconds(1));
        assertNotSame(first, second);
        assertTrue(second.isRunning());
    }
}
