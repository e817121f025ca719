package io.proactive.cron;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A row of the job ledger.
 *
 * @param id           unique identifier, generated at creation
 * @param name         human-readable label
 * @param description  optional free text
 * @param jobType      one-shot or recurring, immutable
 * @param schedule     ISO-8601 instant (one-shot) or cron expression (recurring), immutable
 * @param prompt       instruction handed to the agent verbatim
 * @param nextRunAt    next (or only) instant the job becomes due
 * @param lastRunAt    last successful execution, null if never run
 * @param status       lifecycle status
 * @param failureCount consecutive execution failures since the last success
 * @param createdAt    creation instant
 * @param updatedAt    last modification instant
 */
public record ScheduledJob(
        String id,
        String name,
        String description,
        @JsonProperty("job_type") JobType jobType,
        String schedule,
        String prompt,
        @JsonProperty("next_run_at") Instant nextRunAt,
        @JsonProperty("last_run_at") Instant lastRunAt,
        JobStatus status,
        @JsonProperty("failure_count") int failureCount,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public boolean isRecurring() {
        return jobType == JobType.RECURRING;
    }

    /** True when the job is active and its next run is at or before {@code asOf}. */
    public boolean isDueAt(Instant asOf) {
        return status == JobStatus.ACTIVE && !nextRunAt.isAfter(asOf);
    }
}
