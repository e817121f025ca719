package io.proactive.cron;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for managing scheduled jobs.
 * Supports one-shot (ISO-8601 instant) and recurring (5-field cron) jobs.
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final JobService jobService;
    private final SchedulerRunner schedulerRunner;

    public JobController(JobService jobService, SchedulerRunner schedulerRunner) {
        this.jobService = jobService;
        this.schedulerRunner = schedulerRunner;
    }

    /**
     * Creates a new job. Invalid schedules are rejected with 400.
     */
    @PostMapping
    public ResponseEntity<ScheduledJob> create(@RequestBody CreateJobRequest request) {
        return ResponseEntity.ok(jobService.create(request));
    }

    /**
     * Lists active jobs, or all jobs with {@code ?all=true}.
     */
    @GetMapping
    public ResponseEntity<List<ScheduledJob>> list(@RequestParam(name = "all", defaultValue = "false") boolean all) {
        return ResponseEntity.ok(jobService.list(all));
    }

    /**
     * Returns the ids of jobs currently executing.
     */
    @GetMapping("/running")
    public ResponseEntity<Set<String>> running() {
        return ResponseEntity.ok(schedulerRunner.inFlightJobIds());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduledJob> get(@PathVariable String id) {
        return jobService.get(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<ScheduledJob> pause(@PathVariable String id) {
        return ResponseEntity.ok(jobService.pause(id));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<ScheduledJob> resume(@PathVariable String id) {
        return ResponseEntity.ok(jobService.resume(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id) {
        if (!jobService.delete(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("deleted", true, "id", id));
    }
}
