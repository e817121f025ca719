package io.proactive.cron;

import io.proactive.channel.DeliveryPort;
import io.proactive.config.ActiveHours;
import io.proactive.core.AgentClient;
import io.proactive.core.AgentReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls the job ledger once per tick and runs every due job through the agent.
 *
 * <p>Each due job is dispatched on the dispatch executor without waiting, so a slow job never
 * delays the others or the next tick. A job stays in the in-flight set until its execution
 * finishes; later ticks skip it even though it is still due in the ledger.</p>
 *
 * <p>Outcomes:</p>
 * <ul>
 *   <li>success: the response is delivered to the owner, then a recurring job is rescheduled
 *       (failure count reset) and a one-shot job is completed</li>
 *   <li>failure: the failure count is incremented; at {@value #MAX_FAILURES} the job is marked
 *       failed and a failure alert is delivered</li>
 * </ul>
 *
 * <p>Jobs with a name registered through {@link #registerReservedJob} get their prompt and
 * delivery decision from the {@link ReservedJobHandler} instead.</p>
 */
public class SchedulerRunner {

    private static final Logger log = LoggerFactory.getLogger(SchedulerRunner.class);

    public static final int MAX_FAILURES = 3;
    public static final Duration TICK_INTERVAL = Duration.ofMinutes(1);

    private final JobLedger ledger;
    private final NextRunCalculator calculator;
    private final AgentClient agent;
    private final DeliveryPort delivery;
    private final ActiveHours activeHours;
    private final Clock clock;
    private final Executor dispatchExecutor;

    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();
    private final Map<String, ReservedJobHandler> reservedJobs = new ConcurrentHashMap<>();
    private ScheduledExecutorService timer;
    private ScheduledFuture<?> tickHandle;

    public SchedulerRunner(JobLedger ledger, NextRunCalculator calculator, AgentClient agent,
                           DeliveryPort delivery, ActiveHours activeHours, Clock clock,
                           Executor dispatchExecutor) {
        this.ledger = ledger;
        this.calculator = calculator;
        this.agent = agent;
        this.delivery = delivery;
        this.activeHours = activeHours;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Starts ticking every {@link #TICK_INTERVAL}, beginning immediately.
     */
    public synchronized void start() {
        if (tickHandle != null) {
            log.debug("Scheduler runner already started");
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "scheduler-tick");
            thread.setDaemon(true);
            return thread;
        });
        tickHandle = timer.scheduleAtFixedRate(this::tick, 0, TICK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Scheduler runner started ({}s tick, active hours {})", TICK_INTERVAL.toSeconds(), activeHours);
    }

    /**
     * Cancels the tick timer. Executions already in flight are not awaited.
     */
    public synchronized void stop() {
        if (tickHandle != null) {
            tickHandle.cancel(false);
            tickHandle = null;
        }
        if (timer != null) {
            timer.shutdown();
            timer = null;
        }
        log.info("Scheduler runner stopped");
    }

    public synchronized boolean isRunning() {
        return tickHandle != null;
    }

    public void registerReservedJob(ReservedJobHandler handler) {
        reservedJobs.put(handler.jobName(), handler);
        log.info("Registered handler for reserved job '{}'", handler.jobName());
    }

    /**
     * Returns a snapshot of the ids of jobs currently executing.
     */
    public Set<String> inFlightJobIds() {
        return Set.copyOf(runningJobs);
    }

    /**
     * One evaluation step: dispatches every due job that is not already running.
     * Never throws.
     */
    public void tick() {
        try {
            Instant now = clock.instant();
            if (!activeHours.isActive(now)) {
                log.debug("Outside active hours ({}), skipping scheduler tick", activeHours);
                return;
            }

            List<ScheduledJob> dueJobs = ledger.getDueJobs(now);
            if (dueJobs.isEmpty()) return;

            log.info("Found {} due jobs", dueJobs.size());
            for (ScheduledJob job : dueJobs) {
                if (!runningJobs.add(job.id())) {
                    log.debug("Job {} already running, skipping", job.id());
                    continue;
                }
                // the due list is a snapshot; an execution may have finished since
                Optional<ScheduledJob> current = ledger.getById(job.id());
                if (current.isEmpty() || !current.get().isDueAt(now)) {
                    runningJobs.remove(job.id());
                    log.debug("Job {} no longer due, skipping", job.id());
                    continue;
                }
                dispatch(current.get());
            }
        } catch (Exception e) {
            log.error("Error in scheduler tick", e);
        }
    }

    private void dispatch(ScheduledJob job) {
        try {
            dispatchExecutor.execute(() -> executeJob(job));
        } catch (RejectedExecutionException e) {
            runningJobs.remove(job.id());
            log.error("Could not dispatch job {} '{}'", job.id(), job.name(), e);
        }
    }

    void executeJob(ScheduledJob job) {
        log.info("Executing scheduled job {} '{}'", job.id(), job.name());
        ReservedJobHandler handler = reservedJobs.get(job.name());
        try {
            String prompt = job.prompt();
            if (handler != null) {
                Optional<String> prepared = handler.preparePrompt();
                if (prepared.isEmpty()) {
                    log.debug("Reserved job {} has nothing to do, skipping this run", job.name());
                    advance(job);
                    return;
                }
                prompt = prepared.get();
            }

            AgentReply reply;
            try {
                reply = agent.send(prompt);
            } catch (Exception e) {
                log.error("Job {} '{}' execution failed", job.id(), job.name(), e);
                recordFailure(job);
                return;
            }
            recordSuccess(job, reply, handler);
        } catch (Exception e) {
            log.error("Failed to record outcome of job {} '{}'", job.id(), job.name(), e);
        } finally {
            runningJobs.remove(job.id());
        }
    }

    private void recordSuccess(ScheduledJob job, AgentReply reply, ReservedJobHandler handler) {
        if (handler == null) {
            notifyOwner("*Scheduled: %s*\n\n%s".formatted(job.name(), reply.response()));
        } else if (handler.shouldDeliver(reply)) {
            notifyOwner(reply.response());
        } else {
            log.debug("Reserved job {} reply not delivered", job.name());
        }
        advance(job);
    }

    private void advance(ScheduledJob job) {
        if (job.isRecurring()) {
            Instant nextRun = calculator.computeNextRun(job.schedule(), clock.instant());
            ledger.updateAfterRun(job.id(), Optional.of(nextRun));
            log.info("Recurring job {} rescheduled for {}", job.id(), nextRun);
        } else {
            ledger.updateAfterRun(job.id(), Optional.empty());
            log.info("One-shot job {} completed", job.id());
        }
    }

    private void recordFailure(ScheduledJob job) {
        int failureCount = ledger.incrementFailureCount(job.id());
        if (failureCount >= MAX_FAILURES) {
            ledger.updateStatus(job.id(), JobStatus.FAILED);
            log.warn("Job {} '{}' disabled after {} consecutive failures", job.id(), job.name(), failureCount);
            notifyOwner("*Scheduled job failed: %s*\nDisabled after %d consecutive failures."
                    .formatted(job.name(), failureCount));
        } else {
            log.info("Job {} failure {}/{}, will retry when next due", job.id(), failureCount, MAX_FAILURES);
        }
    }

    private void notifyOwner(String message) {
        try {
            if (!delivery.deliver(message)) {
                log.warn("Scheduler notification was not delivered");
            }
        } catch (RuntimeException e) {
            log.error("Delivery port failed", e);
        }
    }
}
