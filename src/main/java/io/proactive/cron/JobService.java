package io.proactive.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operator-facing job management: validated creation, listing, pause/resume and deletion.
 * Schedules are validated here, once, before a row is written.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobLedger ledger;
    private final NextRunCalculator calculator;
    private final Clock clock;

    public JobService(JobLedger ledger, NextRunCalculator calculator, Clock clock) {
        this.ledger = ledger;
        this.calculator = calculator;
        this.clock = clock;
    }

    /**
     * Creates a job after validating its fields and schedule.
     *
     * @throws IllegalArgumentException if name, type, schedule or prompt is missing
     * @throws InvalidScheduleException if the schedule does not parse for the job type
     */
    public ScheduledJob create(CreateJobRequest request) {
        requireText(request.name(), "name");
        requireText(request.prompt(), "prompt");
        requireText(request.schedule(), "schedule");
        if (request.jobType() == null) {
            throw new IllegalArgumentException("job_type is required ('one_shot' or 'recurring')");
        }

        String schedule = request.schedule().trim();
        Instant nextRun = calculator.initialNextRun(request.jobType(), schedule, clock.instant());
        ScheduledJob job = ledger.create(new CreateJobRequest(
                request.name().trim(), request.description(), request.jobType(), schedule, request.prompt()), nextRun);

        log.info("Added {} job {} '{}' ({}), next run {}",
                job.jobType().value(), job.id(), job.name(), job.schedule(), job.nextRunAt());
        return job;
    }

    public List<ScheduledJob> list(boolean includeTerminal) {
        return ledger.list(includeTerminal);
    }

    public Optional<ScheduledJob> get(String id) {
        return ledger.getById(id);
    }

    public Optional<ScheduledJob> findByName(String name) {
        return ledger.findByName(name);
    }

    /**
     * Pauses an active job.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws JobStateException    if the job is not active
     */
    public ScheduledJob pause(String id) {
        ScheduledJob job = require(id);
        if (job.status() != JobStatus.ACTIVE) {
            throw new JobStateException("Job %s is %s, only active jobs can be paused".formatted(id, job.status().value()));
        }
        ledger.updateStatus(id, JobStatus.PAUSED);
        log.info("Paused job {} '{}'", id, job.name());
        return require(id);
    }

    /**
     * Resumes a paused job, or re-enables a job disabled after repeated failures.
     * A job whose next run already passed becomes due on the next tick.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws JobStateException    if the job is neither paused nor failed
     */
    public ScheduledJob resume(String id) {
        ScheduledJob job = require(id);
        if (job.status() != JobStatus.PAUSED && job.status() != JobStatus.FAILED) {
            throw new JobStateException("Job %s is %s, only paused or failed jobs can be resumed".formatted(id, job.status().value()));
        }
        ledger.updateStatus(id, JobStatus.ACTIVE);
        log.info("Resumed job {} '{}'", id, job.name());
        return require(id);
    }

    /**
     * @return true if the job existed and was removed
     */
    public boolean delete(String id) {
        boolean deleted = ledger.delete(id);
        if (deleted) {
            log.info("Removed job {}", id);
        }
        return deleted;
    }

    private ScheduledJob require(String id) {
        return ledger.getById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
    }
}
