package healrun.runner;

import healrun.model.ExecutionResult;
import healrun.model.SuiteRunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle on one in-flight suite process.
 *
 * <p>The state moves from {@code RUNNING} to exactly one terminal state;
 * the first transition wins. {@link #cancel()} may be called from any thread,
 * {@link #await()} blocks until the process ends or the timeout elapses and
 * always returns the same result once computed.
 */
public final class SuiteRun {

    private static final Logger log = LoggerFactory.getLogger(SuiteRun.class);

    private static final Duration KILL_GRACE  = Duration.ofSeconds(5);
    private static final long     DRAIN_JOIN_MS = 3000;

    private final String suiteName;
    private final Process process;
    private final StreamCollector stdout;
    private final StreamCollector stderr;
    private final String artifactPath;
    private final Duration timeout;
    private final long startNanos;
    private final AtomicReference<SuiteRunState> state;

    private ExecutionResult result;

    private SuiteRun(String suiteName, Process process, StreamCollector stdout, StreamCollector stderr,
                     String artifactPath, Duration timeout, long startNanos,
                     SuiteRunState initial, ExecutionResult result) {
        this.suiteName = suiteName;
        this.process = process;
        this.stdout = stdout;
        this.stderr = stderr;
        this.artifactPath = artifactPath;
        this.timeout = timeout;
        this.startNanos = startNanos;
        this.state = new AtomicReference<>(initial);
        this.result = result;
    }

    static SuiteRun started(String suiteName, Process process, StreamCollector stdout, StreamCollector stderr,
                            String artifactPath, Duration timeout, long startNanos) {
        return new SuiteRun(suiteName, process, stdout, stderr, artifactPath, timeout, startNanos,
                SuiteRunState.RUNNING, null);
    }

    /** A run that never got a process, e.g. because launching failed. */
    static SuiteRun finished(ExecutionResult result) {
        if (result.state() == null || !result.state().isTerminal()) {
            throw new IllegalArgumentException(
                    "Suite '" + result.suiteName() + "' result is not terminal: " + result.state());
        }
        return new SuiteRun(result.suiteName(), null, null, null, result.artifactPath(), Duration.ZERO,
                System.nanoTime(), result.state(), result);
    }

    // ── Public API ──────────────────────────────────────────────────────────

    public String suiteName() {
        return suiteName;
    }

    public SuiteRunState state() {
        return state.get();
    }

    /** Path of the materialized artifact; its directory is owned by this run. May be null if launching failed. */
    public String artifactPath() {
        return artifactPath;
    }

    /** OS pid of the runner process, or -1 if none was started. */
    public long pid() {
        return process == null ? -1 : process.pid();
    }

    /**
     * Kills the process tree and marks the run {@code CANCELED}.
     *
     * @return false if the run had already reached a terminal state
     */
    public boolean cancel() {
        if (process == null || !process.isAlive()) {
            return false;
        }
        if (!state.compareAndSet(SuiteRunState.RUNNING, SuiteRunState.CANCELED)) {
            return false;
        }
        log.warn("Canceling suite '{}' (pid {})", suiteName, process.pid());
        ProcessTrees.destroy(process.toHandle(), KILL_GRACE);
        return true;
    }

    /**
     * Waits for the process to finish or for the timeout to elapse.
     * An interrupt of the waiting thread cancels the run and keeps the
     * interrupt flag set.
     */
    public synchronized ExecutionResult await() {
        if (result != null) {
            return result;
        }

        boolean exited;
        try {
            long remaining = startNanos + timeout.toNanos() - System.nanoTime();
            exited = process.waitFor(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            exited = !process.isAlive();
        }

        if (exited) {
            int code = process.exitValue();
            state.compareAndSet(SuiteRunState.RUNNING, code == 0 ? SuiteRunState.SUCCEEDED : SuiteRunState.FAILED);
        } else if (state.compareAndSet(SuiteRunState.RUNNING, SuiteRunState.TIMED_OUT)) {
            log.warn("Suite '{}' timed out after {} — killing process tree", suiteName, formatTimeout(timeout));
            ProcessTrees.destroy(process.toHandle(), KILL_GRACE);
        }

        drainAndClose();
        result = buildResult();
        log.info("Suite '{}' finished: state={} exitCode={} duration={}s",
                suiteName, result.state(), result.exitCode(), String.format("%.2f", result.durationSeconds()));
        return result;
    }

    // ── Internals ───────────────────────────────────────────────────────────

    private ExecutionResult buildResult() {
        double duration = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        String out = stdout.snapshot();
        String err = stderr.snapshot();
        return switch (state.get()) {
            case SUCCEEDED, FAILED -> ExecutionResult.completed(
                    suiteName, process.exitValue(), out, err, duration, artifactPath);
            case TIMED_OUT -> ExecutionResult.timedOut(
                    suiteName, out, appendLine(err, "Test timed out after " + formatTimeout(timeout)),
                    duration, artifactPath);
            case CANCELED -> ExecutionResult.canceled(
                    suiteName, out, appendLine(err, "Suite '" + suiteName + "' was canceled"),
                    duration, artifactPath);
            case PENDING, RUNNING -> throw new IllegalStateException(
                    "Suite '" + suiteName + "' has no terminal state: " + state.get());
        };
    }

    /** Whole seconds as {@code 5s}, anything else in milliseconds as {@code 300ms}. */
    static String formatTimeout(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    private void drainAndClose() {
        try {
            if (!stdout.join(DRAIN_JOIN_MS) || !stderr.join(DRAIN_JOIN_MS)) {
                log.debug("Output of suite '{}' still open after exit, closing pipes", suiteName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closeQuietly(process.getInputStream());
        closeQuietly(process.getErrorStream());
    }

    private void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Closing pipe of suite '{}' failed: {}", suiteName, e.getMessage());
        }
    }

    private static String appendLine(String text, String line) {
        if (text.isEmpty()) return line;
        return text.endsWith("\n") ? text + line : text + "\n" + line;
    }
}
