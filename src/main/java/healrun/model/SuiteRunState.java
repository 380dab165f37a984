package healrun.model;

/**
 * Lifecycle of one suite invocation. Terminal states are final.
 */
public enum SuiteRunState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
