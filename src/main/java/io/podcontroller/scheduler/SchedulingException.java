package io.podcontroller.scheduler;

/**
 * Eligible nodes could not be determined. Callers retry on their next pass.
 */
public class SchedulingException extends Exception {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
