package io.proactive.heartbeat;

import io.proactive.channel.DeliveryPort;
import io.proactive.config.ActiveHours;
import io.proactive.core.AgentClient;
import io.proactive.core.AgentReply;
import io.proactive.cron.ReservedJobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically asks the agent whether the standing instructions in HEARTBEAT.md need the
 * owner's attention right now.
 *
 * <p>A tick is skipped outside active hours or when the file is missing or blank. The agent
 * answers {@value AgentReply#HEARTBEAT_OK} when nothing is needed; any other answer is
 * delivered unless the same text was already delivered within the dedup window.</p>
 *
 * <p>In ledger mode the timer stays off and the scheduler runs the reserved
 * {@value HeartbeatJobProvisioner#HEARTBEAT_JOB_NAME} job through this runner instead.</p>
 */
public class HeartbeatRunner implements ReservedJobHandler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatRunner.class);

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy h:mm a", Locale.US);

    private final AgentClient agent;
    private final DeliveryPort delivery;
    private final ActiveHours activeHours;
    private final Path heartbeatFile;
    private final Duration interval;
    private final ResponseDeduplicator deduplicator;
    private final Clock clock;

    private ScheduledExecutorService timer;
    private ScheduledFuture<?> tickHandle;

    public HeartbeatRunner(AgentClient agent, DeliveryPort delivery, ActiveHours activeHours,
                           Path heartbeatFile, Duration interval, ResponseDeduplicator deduplicator,
                           Clock clock) {
        this.agent = agent;
        this.delivery = delivery;
        this.activeHours = activeHours;
        this.heartbeatFile = heartbeatFile;
        this.interval = interval;
        this.deduplicator = deduplicator;
        this.clock = clock;
    }

    public synchronized void start() {
        if (tickHandle != null) {
            log.debug("Heartbeat runner already started");
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "heartbeat-tick");
            thread.setDaemon(true);
            return thread;
        });
        tickHandle = timer.scheduleAtFixedRate(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Heartbeat runner started: every {} minutes, file: {}", interval.toMinutes(), heartbeatFile);
    }

    public synchronized void stop() {
        if (tickHandle != null) {
            tickHandle.cancel(false);
            tickHandle = null;
        }
        if (timer != null) {
            timer.shutdown();
            timer = null;
        }
        log.info("Heartbeat runner stopped");
    }

    public synchronized boolean isRunning() {
        return tickHandle != null;
    }

    /**
     * Runs a heartbeat check immediately, outside the schedule.
     */
    public void triggerNow() {
        log.info("Triggering immediate heartbeat check");
        tick();
    }

    /**
     * One heartbeat check. Never throws.
     */
    public void tick() {
        try {
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(activeHours.zone()));
            if (!activeHours.isActive(now.toInstant())) {
                log.debug("Outside active hours ({}), skipping heartbeat", activeHours);
                return;
            }

            Optional<String> prompt = preparePrompt(now);
            if (prompt.isEmpty()) {
                return;
            }

            log.debug("Running heartbeat check");
            AgentReply reply = agent.send(prompt.get());
            if (!shouldDeliver(reply)) {
                return;
            }

            if (delivery.deliver(reply.response())) {
                log.info("Heartbeat notification delivered");
            } else {
                log.warn("Heartbeat notification was not delivered");
            }
        } catch (Exception e) {
            log.error("Error in heartbeat tick", e);
        }
    }

    @Override
    public String jobName() {
        return HeartbeatJobProvisioner.HEARTBEAT_JOB_NAME;
    }

    /**
     * Builds the heartbeat prompt from the current file content, or returns empty when the file
     * is missing or blank.
     */
    @Override
    public Optional<String> preparePrompt() {
        return preparePrompt(ZonedDateTime.now(clock.withZone(activeHours.zone())));
    }

    private Optional<String> preparePrompt(ZonedDateTime now) {
        return readInstructions().map(instructions -> buildPrompt(instructions, now));
    }

    /**
     * Rejects {@value AgentReply#HEARTBEAT_OK} and responses already delivered within the dedup window.
     */
    @Override
    public boolean shouldDeliver(AgentReply reply) {
        if (reply.isHeartbeatOk()) {
            log.debug("Heartbeat returned OK, no notification needed");
            return false;
        }
        if (deduplicator.isDuplicate(reply.response())) {
            log.debug("Duplicate heartbeat response suppressed");
            return false;
        }
        return true;
    }

    private Optional<String> readInstructions() {
        if (!Files.exists(heartbeatFile)) {
            log.debug("No heartbeat file found at {}, skipping", heartbeatFile);
            return Optional.empty();
        }
        String content;
        try {
            content = Files.readString(heartbeatFile).trim();
        } catch (IOException e) {
            log.debug("Heartbeat file {} not readable, skipping: {}", heartbeatFile, e.getMessage());
            return Optional.empty();
        }
        if (content.isEmpty()) {
            log.debug("Heartbeat file is empty, skipping");
            return Optional.empty();
        }
        return Optional.of(content);
    }

    static String buildPrompt(String instructions, ZonedDateTime now) {
        return """
                # Heartbeat Check

                Current time: %s
                Timezone: %s

                ## Standing Instructions

                %s

                ---

                Review the standing instructions above. If any action is needed right now (e.g., upcoming events to notify about, tasks due soon, information to check), provide a concise notification message.

                If nothing requires attention right now, respond with exactly: %s""".formatted(
                TIME_FORMAT.format(now), now.getZone().getId(), instructions, AgentReply.HEARTBEAT_OK);
    }
}
