package io.proactive.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a scheduled job.
 * Only {@code ACTIVE} jobs are ever selected as due.
 */
public enum JobStatus {
    ACTIVE("active"),
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** True for statuses a job never leaves on its own. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        if (value != null) {
            for (JobStatus status : values()) {
                if (status.value.equalsIgnoreCase(value.trim())) return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
