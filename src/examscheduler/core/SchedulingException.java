package examscheduler.core;

/**
 * Base of every failure a caller can fix by changing its input and running again.
 */
public class SchedulingException extends Exception {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
