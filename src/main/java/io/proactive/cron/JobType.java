package io.proactive.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of scheduled job. Fixed at creation.
 *
 * <ul>
 *   <li>{@code ONE_SHOT}: runs once at the ISO-8601 instant in its schedule.</li>
 *   <li>{@code RECURRING}: runs on every match of its 5-field cron expression.</li>
 * </ul>
 */
public enum JobType {
    ONE_SHOT("one_shot"),
    RECURRING("recurring");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    /** Returns the persisted / wire form, e.g. {@code one_shot}. */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses the wire form.
     *
     * @throws IllegalArgumentException if the value is not a known job type
     */
    @JsonCreator
    public static JobType fromValue(String value) {
        if (value != null) {
            for (JobType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) return type;
            }
        }
        throw new IllegalArgumentException(
                "Invalid job_type: %s. Must be 'one_shot' or 'recurring'.".formatted(value));
    }
}
