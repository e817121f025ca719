package io.proactive.cron;

/**
 * Thrown when a cron expression or ISO-8601 timestamp cannot be parsed,
 * or when a cron expression can never fire.
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
