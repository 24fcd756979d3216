package examscheduler.core;

/**
 * Input rejected before any placement was attempted.
 */
public class InvalidConstraintException extends SchedulingException {

    public InvalidConstraintException(String message) {
        super(message);
    }
}
