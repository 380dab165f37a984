package healrun.scheduler;

/**
 * A plan breaks a scheduling invariant, e.g. a shared-context suite with more
 * than one worker. Only reachable when a plan is built by hand.
 */
public class SchedulingInvariantViolationException extends RuntimeException {

    public SchedulingInvariantViolationException(String message) {
        super(message);
    }
}
