package io.proactive.heartbeat;

import io.proactive.cron.CreateJobRequest;
import io.proactive.cron.JobService;
import io.proactive.cron.JobType;
import io.proactive.cron.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Provisions the reserved heartbeat job in the ledger when the heartbeat runs in ledger mode.
 * The job is created once; later startups find it by name and leave it alone. Its runs go
 * through {@link HeartbeatRunner} as a {@link io.proactive.cron.ReservedJobHandler}.
 */
public class HeartbeatJobProvisioner {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatJobProvisioner.class);
    public static final String HEARTBEAT_JOB_NAME = "__heartbeat__";

    private final JobService jobService;
    private final int intervalMinutes;
    private final String heartbeatFile;

    public HeartbeatJobProvisioner(JobService jobService, int intervalMinutes, String heartbeatFile) {
        this.jobService = jobService;
        this.intervalMinutes = intervalMinutes;
        this.heartbeatFile = heartbeatFile;
    }

    /**
     * Creates the reserved job unless a non-terminal one already exists.
     *
     * @return the existing or newly created job
     */
    public ScheduledJob ensureProvisioned() {
        Optional<ScheduledJob> existing = jobService.findByName(HEARTBEAT_JOB_NAME);
        if (existing.isPresent()) {
            log.debug("Heartbeat job already provisioned: {}", existing.get().id());
            return existing.get();
        }

        String cron = buildCronExpression(intervalMinutes);
        ScheduledJob job = jobService.create(new CreateJobRequest(
                HEARTBEAT_JOB_NAME,
                "Reserved heartbeat job checking the standing instructions",
                JobType.RECURRING,
                cron,
                buildPrompt()));
        log.info("Heartbeat job provisioned with cron: {}", cron);
        return job;
    }

    // stored for operators listing jobs; the scheduler asks HeartbeatRunner for the real prompt
    private String buildPrompt() {
        return "Heartbeat check against the standing instructions in " + heartbeatFile;
    }

    /**
     * Builds a cron expression for the given interval in minutes.
     * Below an hour the interval is a minute step, above it an hour step (rounded down),
     * and a day or longer runs daily at midnight.
     */
    static String buildCronExpression(int intervalMinutes) {
        if (intervalMinutes <= 0) throw new IllegalArgumentException("Interval must be positive");
        if (intervalMinutes < 60) {
            return "*/%d * * * *".formatted(intervalMinutes);
        }
        int hours = intervalMinutes / 60;
        if (hours >= 24) {
            return "0 0 * * *";
        }
        return "0 */%d * * *".formatted(hours);
    }
}
