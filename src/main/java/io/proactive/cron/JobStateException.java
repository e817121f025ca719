package io.proactive.cron;

/**
 * An operator transition (pause, resume) is not allowed from the job's current status.
 */
public class JobStateException extends RuntimeException {

    public JobStateException(String message) {
        super(message);
    }
}
