package healrun.runner;

import healrun.model.ExecutionPlan;
import healrun.model.ExecutionResult;
import healrun.model.Suite;
import healrun.scheduler.PlanValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every suite of an {@link ExecutionPlan} through a {@link SuiteExecutor},
 * at most {@code maxConcurrentSuites} at a time.
 *
 * <p>A failing suite never stops the others. {@link #abort()} cancels every
 * in-flight suite and turns suites that have not started yet into
 * {@code CANCELED} results.
 *
 * <p>Each suite's working directory is removed once its result is in, unless
 * {@link #setKeepRunDirectories(boolean)} asks to keep them for inspection.
 */
public class PlanRunner {

    private static final Logger log = LoggerFactory.getLogger(PlanRunner.class);

    private final SuiteExecutor executor;
    private final SuiteCodeSource codeSource;
    private final int maxConcurrentSuites;
    private final Duration timeout;

    private final Set<SuiteRun> active = ConcurrentHashMap.newKeySet();
    private volatile boolean aborted;
    private boolean keepRunDirectories;

    public PlanRunner(SuiteExecutor executor, SuiteCodeSource codeSource, int maxConcurrentSuites) {
        this(executor, codeSource, maxConcurrentSuites, executor.getDefaultTimeout());
    }

    public PlanRunner(SuiteExecutor executor, SuiteCodeSource codeSource, int maxConcurrentSuites,
                      Duration timeout) {
        if (maxConcurrentSuites < 1) {
            throw new IllegalArgumentException("maxConcurrentSuites must be >= 1, got " + maxConcurrentSuites);
        }
        this.executor = executor;
        this.codeSource = codeSource;
        this.maxConcurrentSuites = maxConcurrentSuites;
        this.timeout = timeout;
    }

    /** Keeps each suite's working directory after it finishes instead of deleting it. */
    public void setKeepRunDirectories(boolean keep) {
        this.keepRunDirectories = keep;
    }

    /**
     * Runs the plan and returns one result per executed suite, in plan order.
     * Suites without code are skipped and have no result.
     *
     * @throws healrun.scheduler.SchedulingInvariantViolationException if the plan is invalid
     */
    public List<ExecutionResult> run(ExecutionPlan plan) {
        PlanValidator.validate(plan);
        aborted = false;
        if (plan.isEmpty()) {
            log.info("Execution plan is empty — nothing to run");
            return List.of();
        }

        int poolSize = Math.min(maxConcurrentSuites, plan.suites().size());
        log.info("Running {} suite(s) / {} case(s), up to {} at a time",
                plan.suites().size(), plan.totalCases(), poolSize);

        ExecutorService pool = Executors.newFixedThreadPool(poolSize, suiteThreads());
        List<Future<Optional<ExecutionResult>>> futures = new ArrayList<>();
        try {
            for (Suite suite : plan.suites()) {
                futures.add(pool.submit(() -> runSuite(suite)));
            }
            pool.shutdown();

            List<ExecutionResult> results = new ArrayList<>();
            for (Future<Optional<ExecutionResult>> future : futures) {
                awaitResult(future).ifPresent(results::add);
            }
            logSummary(results);
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    /** Cancels in-flight suites; suites not started yet come back CANCELED. Safe from any thread. */
    public void abort() {
        aborted = true;
        log.warn("Run aborted — canceling {} in-flight suite(s)", active.size());
        for (SuiteRun run : active) {
            run.cancel();
        }
    }

    public boolean isAborted() {
        return aborted;
    }

    // ── Per suite ───────────────────────────────────────────────────────────

    private Optional<ExecutionResult> runSuite(Suite suite) {
        if (aborted) {
            return Optional.of(ExecutionResult.canceled(suite.name(), "",
                    "Run aborted before suite '" + suite.name() + "' started", 0.0, null));
        }

        String code;
        try {
            code = codeSource.codeFor(suite);
        } catch (IOException e) {
            log.error("Cannot load code for suite '{}': {}", suite.name(), e.getMessage());
            return Optional.of(ExecutionResult.launchFailed(suite.name(),
                    "Cannot load suite code: " + e.getMessage(), 0.0, null));
        }
        if (code == null || code.isBlank()) {
            log.warn("No compiled code for suite '{}' — skipping", suite.name());
            return Optional.empty();
        }

        SuiteRun run = executor.start(suite.name(), code, suite.workers(), timeout);
        active.add(run);
        try {
            // abort() may have run between the check above and registration
            if (aborted) {
                run.cancel();
            }
            ExecutionResult result = run.await();
            if (!keepRunDirectories) {
                executor.cleanUp(result);
            }
            return Optional.of(result);
        } finally {
            active.remove(run);
        }
    }

    private Optional<ExecutionResult> awaitResult(Future<Optional<ExecutionResult>> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    abort();
                } catch (ExecutionException e) {
                    abort();
                    throw new IllegalStateException("Suite execution crashed", e.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void logSummary(List<ExecutionResult> results) {
        long passed = results.stream().filter(ExecutionResult::success).count();
        long timedOut = results.stream().filter(ExecutionResult::timedOut).count();
        long canceled = results.stream().filter(ExecutionResult::isCanceled).count();
        log.info("Run finished: {} suite(s), {} passed, {} failed ({} timed out, {} canceled)",
                results.size(), passed, results.size() - passed, timedOut, canceled);
    }

    private static ThreadFactory suiteThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "healrun-suite-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
