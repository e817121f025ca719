package io.proactive.cron;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobService jobService;

    @MockBean
    private SchedulerRunner schedulerRunner;

    private static ScheduledJob job(String id, JobType type, String schedule, JobStatus status) {
        Instant created = Instant.parse("2025-01-01T08:00:00Z");
        return new ScheduledJob(id, "Daily", null, type, schedule, "report",
                Instant.parse("2025-01-01T09:00:00Z"), null, status, 0, created, created);
    }

    @Test
    void shouldCreateRecurringJob() throws Exception {
        when(jobService.create(any())).thenReturn(job("abc", JobType.RECURRING, "0 9 * * *", JobStatus.ACTIVE));

        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Daily", "job_type": "recurring", "schedule": "0 9 * * *", "prompt": "report"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("abc"))
                .andExpect(jsonPath("$.job_type").value("recurring"))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.failure_count").value(0))
                .andExpect(jsonPath("$.next_run_at").value("2025-01-01T09:00:00Z"));

        verify(jobService).create(new CreateJobRequest("Daily", null, JobType.RECURRING, "0 9 * * *", "report"));
    }

    @Test
    void shouldRejectInvalidSchedule() throws Exception {
        when(jobService.create(any())).thenThrow(new InvalidScheduleException("Invalid cron expression: bad"));

        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Daily", "job_type": "recurring", "schedule": "bad", "prompt": "report"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid cron expression: bad"));
    }

    @Test
    void shouldRejectUnknownJobType() throws Exception {
        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Daily", "job_type": "weekly", "schedule": "0 9 * * *", "prompt": "report"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(jobService);
    }

    @Test
    void shouldRejectMissingName() throws Exception {
        when(jobService.create(any())).thenThrow(new IllegalArgumentException("'name' is required"));

        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"job_type": "one_shot", "schedule": "2025-01-01T10:00:00Z", "prompt": "report"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("'name' is required"));
    }

    @Test
    void shouldListActiveJobsByDefault() throws Exception {
        when(jobService.list(false)).thenReturn(List.of(job("abc", JobType.RECURRING, "0 9 * * *", JobStatus.ACTIVE)));

        mockMvc.perform(get("/api/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("abc"));

        verify(jobService).list(false);
    }

    @Test
    void shouldListAllJobs() throws Exception {
        when(jobService.list(true)).thenReturn(List.of(
                job("abc", JobType.RECURRING, "0 9 * * *", JobStatus.ACTIVE),
                job("def", JobType.ONE_SHOT, "2025-01-01T09:00:00Z", JobStatus.COMPLETED)));

        mockMvc.perform(get("/api/jobs").param("all", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].status").value("completed"));
    }

    @Test
    void shouldReturnRunningJobIds() throws Exception {
        when(schedulerRunner.inFlightJobIds()).thenReturn(Set.of("abc"));

        mockMvc.perform(get("/api/jobs/running"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("abc"));
    }

    @Test
    void shouldGetJobOr404() throws Exception {
        when(jobService.get("abc")).thenReturn(Optional.of(job("abc", JobType.RECURRING, "0 9 * * *", JobStatus.ACTIVE)));
        when(jobService.get("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/jobs/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Daily"));
        mockMvc.perform(get("/api/jobs/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldPauseJob() throws Exception {
        when(jobService.pause("abc")).thenReturn(job("abc", JobType.RECURRING, "0 9 * * *", JobStatus.PAUSED));

        mockMvc.perform(post("/api/jobs/abc/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("paused"));
    }

    @Test
    void shouldMapInvalidTransitionToConflict() throws Exception {
        when(jobService.resume("abc")).thenThrow(new JobStateException("Job abc is completed, only paused or failed jobs can be resumed"));

        mockMvc.perform(post("/api/jobs/abc/resume"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Job abc is completed, only paused or failed jobs can be resumed"));
    }

    @Test
    void shouldMapUnknownJobToNotFound() throws Exception {
        when(jobService.pause("nope")).thenThrow(new JobNotFoundException("nope"));

        mockMvc.perform(post("/api/jobs/nope/pause"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Job not found: nope"));
    }

    @Test
    void shouldMapLedgerFailureToServiceUnavailable() throws Exception {
        when(jobService.list(false)).thenThrow(new LedgerException("Failed to list jobs", null));

        mockMvc.perform(get("/api/jobs"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Failed to list jobs"));
    }

    @Test
    void shouldDeleteJob() throws Exception {
        when(jobService.delete("abc")).thenReturn(true);
        when(jobService.delete("nope")).thenReturn(false);

        mockMvc.perform(delete("/api/jobs/abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true))
                .andExpect(jsonPath("$.id").value("abc"));
        mockMvc.perform(delete("/api/jobs/nope"))
                .andExpect(status().isNotFound());
    }
}
