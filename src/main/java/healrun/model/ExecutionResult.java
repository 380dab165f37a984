package healrun.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one suite invocation, produced once per run of a suite.
 *
 * <p>Negative exit codes are sentinels and never come from a real process:
 * {@link #TIMEOUT_EXIT_CODE}, {@link #CANCELED_EXIT_CODE},
 * {@link #LAUNCH_FAILED_EXIT_CODE}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
        @JsonProperty("suiteName") String suiteName,
        @JsonProperty("state") SuiteRunState state,
        @JsonProperty("success") boolean success,
        @JsonProperty("exitCode") int exitCode,
        @JsonProperty("stdout") String stdout,
        @JsonProperty("stderr") String stderr,
        @JsonProperty("timedOut") boolean timedOut,
        @JsonProperty("durationSeconds") double durationSeconds,
        @JsonProperty("artifactPath") String artifactPath) {

    public static final int TIMEOUT_EXIT_CODE       = -1;
    public static final int CANCELED_EXIT_CODE      = -2;
    public static final int LAUNCH_FAILED_EXIT_CODE = -3;

    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    /** Normal process exit; success iff {@code exitCode == 0}. */
    public static ExecutionResult completed(String suiteName, int exitCode, String stdout, String stderr,
                                            double durationSeconds, String artifactPath) {
        return new ExecutionResult(suiteName,
                exitCode == 0 ? SuiteRunState.SUCCEEDED : SuiteRunState.FAILED,
                exitCode == 0, exitCode, stdout, stderr, false, durationSeconds, artifactPath);
    }

    public static ExecutionResult timedOut(String suiteName, String stdout, String stderr,
                                           double durationSeconds, String artifactPath) {
        return new ExecutionResult(suiteName, SuiteRunState.TIMED_OUT, false, TIMEOUT_EXIT_CODE,
                stdout, stderr, true, durationSeconds, artifactPath);
    }

    public static ExecutionResult canceled(String suiteName, String stdout, String stderr,
                                           double durationSeconds, String artifactPath) {
        return new ExecutionResult(suiteName, SuiteRunState.CANCELED, false, CANCELED_EXIT_CODE,
                stdout, stderr, false, durationSeconds, artifactPath);
    }

    public static ExecutionResult launchFailed(String suiteName, String reason,
                                               double durationSeconds, String artifactPath) {
        return new ExecutionResult(suiteName, SuiteRunState.FAILED, false, LAUNCH_FAILED_EXIT_CODE,
                "", reason, false, durationSeconds, artifactPath);
    }

    @JsonIgnore
    public boolean isCanceled() {
        return state == SuiteRunState.CANCELED;
    }
}
