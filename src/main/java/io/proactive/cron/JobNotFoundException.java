package io.proactive.cron;

/**
 * No job exists with the requested id.
 */
public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String id) {
        super("Job not found: " + id);
    }
}
