package burst.fleet.setup;

import burst.error.BurstException;
import burst.error.ConnectionException;
import burst.error.SetupRoutineException;
import burst.fleet.model.FleetInstance;
import burst.fleet.model.SetupRoutine;
import burst.ssh.RemoteSession;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every group's setup routine on every instance of that group, all in parallel.
 * A failing instance never stops its siblings: each instance is attempted exactly once
 * and every failure is collected into the returned report.
 */
public class ParallelSetupExecutor {

    private final SessionOpener opener;
    private final int parallelism;
    private final Logger log;

    public ParallelSetupExecutor(SessionOpener opener, int parallelism, Logger log) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.opener = opener;
        this.parallelism = parallelism;
        this.log = log;
    }

    public SetupReport run(Map<String, List<FleetInstance>> machines, Map<String, SetupRoutine> routines) {
        Queue<BurstException> errors = new ConcurrentLinkedQueue<>();
        List<Callable<Void>> tasks = new ArrayList<>();

        for (Map.Entry<String, List<FleetInstance>> entry : machines.entrySet()) {
            String name = entry.getKey();
            SetupRoutine routine = routines.get(name);
            if (routine == null) {
                throw new IllegalArgumentException("no setup routine for group " + name);
            }
            for (FleetInstance machine : entry.getValue()) {
                tasks.add(() -> {
                    setUp(name, machine, routine, errors);
                    return null;
                });
            }
        }

        if (tasks.isEmpty()) {
            return new SetupReport(0, List.of());
        }

        ExecutorService pool = newPool(Math.min(parallelism, tasks.size()));
        try {
            List<Future<Void>> futures = pool.invokeAll(tasks);
            for (Future<Void> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    // setUp catches everything it expects; this is an Error escaping a routine
                    errors.add(new SetupRoutineException("setup task failed unexpectedly", e.getCause()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BurstException("interrupted while running setup routines", e);
        } finally {
            pool.shutdownNow();
        }

        return new SetupReport(tasks.size(), new ArrayList<>(errors));
    }

    private void setUp(String name, FleetInstance machine, SetupRoutine routine, Queue<BurstException> errors) {
        RemoteSession session;
        try {
            session = opener.open(machine);
        } catch (BurstException e) {
            log.error("failed to ssh to {}:{}", name, machine.publicIp());
            errors.add(e);
            return;
        } catch (RuntimeException e) {
            log.error("failed to ssh to {}:{}", name, machine.publicIp());
            errors.add(new ConnectionException("failed to ssh to " + name + " machine " + machine.publicIp(), e));
            return;
        }
        machine.attachSession(session);

        log.debug("setting up {} instance ip={}", name, machine.publicIp());
        try {
            routine.setup(session);
        } catch (Exception e) {
            log.error("setup for {} machine {} failed", name, machine.publicIp());
            errors.add(new SetupRoutineException(
                    "setup routine for " + name + " machine " + machine.publicIp() + " failed", e));
            return;
        }
        log.info("finished setting up {} instance ip={}", name, machine.publicIp());
    }

    private static ExecutorService newPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "burst-setup-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
