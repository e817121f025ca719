package io.proactive.config;

import io.proactive.cron.SchedulerRunner;
import io.proactive.heartbeat.HeartbeatJobProvisioner;
import io.proactive.heartbeat.HeartbeatRunner;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the scheduler and heartbeat once the application is ready and stops them on shutdown.
 * The job ledger is closed afterwards by its own bean lifecycle.
 */
@Component
public class ProactiveLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ProactiveLifecycle.class);

    private final ProactiveProperties properties;
    private final SchedulerRunner schedulerRunner;
    private final ObjectProvider<HeartbeatRunner> heartbeatRunner;
    private final HeartbeatJobProvisioner heartbeatJobProvisioner;

    public ProactiveLifecycle(ProactiveProperties properties, SchedulerRunner schedulerRunner,
                              ObjectProvider<HeartbeatRunner> heartbeatRunner,
                              HeartbeatJobProvisioner heartbeatJobProvisioner) {
        this.properties = properties;
        this.schedulerRunner = schedulerRunner;
        this.heartbeatRunner = heartbeatRunner;
        this.heartbeatJobProvisioner = heartbeatJobProvisioner;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.enabled()) {
            log.info("Proactive systems disabled via configuration");
            return;
        }

        var heartbeat = properties.heartbeat();
        if (heartbeat.enabled() && heartbeat.ledgerMode()) {
            heartbeatRunner.ifAvailable(schedulerRunner::registerReservedJob);
            heartbeatJobProvisioner.ensureProvisioned();
        }

        schedulerRunner.start();

        if (!heartbeat.enabled()) {
            log.info("Heartbeat disabled via configuration");
        } else if (!heartbeat.ledgerMode()) {
            heartbeatRunner.ifAvailable(HeartbeatRunner::start);
        }
        log.info("Proactive systems enabled");
    }

    @PreDestroy
    public void stop() {
        schedulerRunner.stop();
        heartbeatRunner.ifAvailable(HeartbeatRunner::stop);
    }
}
