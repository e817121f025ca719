package io.proactive.cron;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of scheduled jobs and the single source of truth for their status.
 *
 * <p>Every mutation is atomic from the caller's point of view. Reads return empty results
 * for missing rows; store failures surface as {@link LedgerException}.</p>
 */
public interface JobLedger extends AutoCloseable {

    /**
     * Inserts a new active job with a zero failure count.
     *
     * @param request        the job definition
     * @param initialNextRun the first instant the job becomes due
     * @return the persisted row
     */
    ScheduledJob create(CreateJobRequest request, Instant initialNextRun);

    Optional<ScheduledJob> getById(String id);

    /**
     * Finds a non-terminal (active or paused) job by name.
     * Used to avoid provisioning a reserved job twice.
     */
    Optional<ScheduledJob> findByName(String name);

    /**
     * Lists jobs ordered by {@code next_run_at}.
     *
     * @param includeTerminal false returns only active jobs
     */
    List<ScheduledJob> list(boolean includeTerminal);

    /**
     * Returns active jobs with {@code next_run_at <= asOf}, earliest first.
     */
    List<ScheduledJob> getDueJobs(Instant asOf);

    /**
     * Records a successful execution.
     *
     * @param nextRun present for recurring jobs (advances the schedule and resets the failure
     *                count), empty for one-shot jobs (marks the job completed)
     */
    void updateAfterRun(String id, Optional<Instant> nextRun);

    /**
     * Increments the consecutive failure counter.
     *
     * @return the new count, or 0 if the job no longer exists
     */
    int incrementFailureCount(String id);

    void updateStatus(String id, JobStatus status);

    /**
     * @return true if a row was removed
     */
    boolean delete(String id);

    @Override
    void close();
}
