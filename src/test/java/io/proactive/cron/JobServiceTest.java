package io.proactive.cron;

import io.proactive.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T08:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteJobLedger ledger;
    private JobService jobService;

    @BeforeEach
    void setUp() {
        var clock = new MutableClock(NOW);
        ledger = new SqliteJobLedger(tempDir.resolve("scheduler.db").toString(), clock);
        ledger.init();
        jobService = new JobService(ledger, new NextRunCalculator(ZoneOffset.UTC), clock);
    }

    @AfterEach
    void tearDown() {
        ledger.close();
    }

    @Test
    void shouldCreateRecurringJobWithComputedNextRun() {
        ScheduledJob job = jobService.create(CreateJobRequest.recurring("  Morning brief ", " 0 9 * * * ", "Summarize"));

        assertEquals("Morning brief", job.name());
        assertEquals("0 9 * * *", job.schedule());
        assertEquals(Instant.parse("2025-01-01T09:00:00Z"), job.nextRunAt());
        assertEquals(JobStatus.ACTIVE, job.status());
    }

    @Test
    void shouldCreateOneShotJobInThePast() {
        ScheduledJob job = jobService.create(CreateJobRequest.oneShot("Catch up", "2024-12-31T23:00:00Z", "p"));

        assertEquals(Instant.parse("2024-12-31T23:00:00Z"), job.nextRunAt());
        assertEquals(1, ledger.getDueJobs(NOW).size());
    }

    @Test
    void shouldRejectInvalidScheduleWithoutWriting() {
        assertThrows(InvalidScheduleException.class,
                () -> jobService.create(CreateJobRequest.recurring("Bad", "every day", "p")));
        assertThrows(InvalidScheduleException.class,
                () -> jobService.create(CreateJobRequest.oneShot("Bad", "next tuesday", "p")));

        assertTrue(jobService.list(true).isEmpty());
    }

    @Test
    void shouldRejectMissingFields() {
        var missingName = assertThrows(IllegalArgumentException.class,
                () -> jobService.create(CreateJobRequest.recurring(" ", "0 9 * * *", "p")));
        assertEquals("'name' is required", missingName.getMessage());

        assertThrows(IllegalArgumentException.class,
                () -> jobService.create(CreateJobRequest.recurring("n", "0 9 * * *", null)));
        assertThrows(IllegalArgumentException.class,
                () -> jobService.create(CreateJobRequest.recurring("n", "", "p")));
        assertThrows(IllegalArgumentException.class,
                () -> jobService.create(new CreateJobRequest("n", null, null, "0 9 * * *", "p")));
    }

    @Test
    void shouldPauseAndResumeJob() {
        ScheduledJob job = jobService.create(CreateJobRequest.recurring("r", "0 9 * * *", "p"));

        assertEquals(JobStatus.PAUSED, jobService.pause(job.id()).status());
        assertTrue(jobService.list(false).isEmpty());
        assertEquals(JobStatus.ACTIVE, jobService.resume(job.id()).status());
    }

    @Test
    void shouldRejectInvalidTransitions() {
        ScheduledJob job = jobService.create(CreateJobRequest.oneShot("o", "2025-01-01T08:00:00Z", "p"));

        assertThrows(JobStateException.class, () -> jobService.resume(job.id()));

        ledger.updateAfterRun(job.id(), Optional.empty());
        assertThrows(JobStateException.class, () -> jobService.pause(job.id()));
        assertThrows(JobStateException.class, () -> jobService.resume(job.id()));
    }

    @Test
    void shouldResumeFailedJobKeepingFailureCount() {
        ScheduledJob job = jobService.create(CreateJobRequest.recurring("r", "0 9 * * *", "p"));
        ledger.incrementFailureCount(job.id());
        ledger.incrementFailureCount(job.id());
        ledger.incrementFailureCount(job.id());
        ledger.updateStatus(job.id(), JobStatus.FAILED);

        ScheduledJob resumed = jobService.resume(job.id());

        assertEquals(JobStatus.ACTIVE, resumed.status());
        assertEquals(3, resumed.failureCount());
    }

    @Test
    void shouldFailForUnknownJob() {
        var e = assertThrows(JobNotFoundException.class, () -> jobService.pause("missing"));
        assertEquals("Job not found: missing", e.getMessage());
        assertThrows(JobNotFoundException.class, () -> jobService.resume("missing"));
        assertTrue(jobService.get("missing").isEmpty());
        assertFalse(jobService.delete("missing"));
    }

    @Test
    void shouldDeleteJob() {
        ScheduledJob job = jobService.create(CreateJobRequest.recurring("r", "0 9 * * *", "p"));

        assertTrue(jobService.delete(job.id()));
        assertTrue(jobService.get(job.id()).isEmpty());
    }
}
