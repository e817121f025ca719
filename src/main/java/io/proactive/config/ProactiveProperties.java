package io.proactive.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Configuration for the proactive scheduler and heartbeat.
 *
 * <p>Binds to {@code proactive} in application.yml:</p>
 * <pre>
 * proactive:
 *   enabled: true
 *   timezone: Europe/Brussels
 *   active-hours:
 *     start: 8
 *     end: 22
 *   scheduler:
 *     database-path: ./data/scheduler.db
 *   heartbeat:
 *     enabled: true
 *     mode: runner
 *     interval-minutes: 30
 *     file: ./HEARTBEAT.md
 *   delivery:
 *     owner-channel: telegram
 *   telegram:
 *     enabled: true
 *     token: ${TELEGRAM_BOT_TOKEN}
 *     chat-id: 123456789
 * </pre>
 *
 * @param enabled     whether the scheduler and heartbeat runners are started
 * @param timezone    zone for cron evaluation, active hours and the heartbeat clock; blank = system default
 * @param activeHours hour-of-day window in which proactive work may run
 * @param scheduler   job ledger settings
 * @param heartbeat   standing-instructions heartbeat settings
 * @param delivery    owner notification routing
 * @param telegram    Telegram bot used as a delivery channel
 */
@ConfigurationProperties(prefix = "proactive")
public record ProactiveProperties(
        Boolean enabled,
        String timezone,
        ActiveHoursConfig activeHours,
        SchedulerConfig scheduler,
        HeartbeatConfig heartbeat,
        DeliveryConfig delivery,
        TelegramConfig telegram
) {

    public ProactiveProperties {
        if (enabled == null) enabled = true;
        if (activeHours == null) activeHours = new ActiveHoursConfig(null, null);
        if (scheduler == null) scheduler = new SchedulerConfig(null);
        if (heartbeat == null) heartbeat = new HeartbeatConfig(null, null, null, null);
        if (delivery == null) delivery = new DeliveryConfig(null);
        if (telegram == null) telegram = new TelegramConfig(null, null, null);
    }

    /** Returns the configured zone, falling back to the system default. */
    public ZoneId zoneId() {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone.trim());
    }

    /**
     * @param start first active hour, inclusive (0-23)
     * @param end   end hour, exclusive (0-24)
     */
    public record ActiveHoursConfig(Integer start, Integer end) {
        public ActiveHoursConfig {
            if (start == null) start = 8;
            if (end == null) end = 22;
            if (start < 0 || start > 23) {
                throw new IllegalArgumentException("proactive.active-hours.start must be within 0-23, got " + start);
            }
            if (end < 0 || end > 24) {
                throw new IllegalArgumentException("proactive.active-hours.end must be within 0-24, got " + end);
            }
        }
    }

    /**
     * @param databasePath SQLite file holding the job ledger
     */
    public record SchedulerConfig(String databasePath) {
        public SchedulerConfig {
            if (databasePath == null || databasePath.isBlank()) databasePath = "./data/scheduler.db";
        }
    }

    /**
     * @param enabled         whether the heartbeat runs at all
     * @param mode            {@code runner} for the standalone loop, {@code ledger} for a reserved ledger job
     * @param intervalMinutes minutes between heartbeat checks
     * @param file            standing-instructions document
     */
    public record HeartbeatConfig(Boolean enabled, String mode, Integer intervalMinutes, String file) {
        public HeartbeatConfig {
            if (enabled == null) enabled = true;
            if (mode == null || mode.isBlank()) mode = "runner";
            if (intervalMinutes == null) intervalMinutes = 30;
            if (file == null || file.isBlank()) file = "./HEARTBEAT.md";
            if (intervalMinutes <= 0) {
                throw new IllegalArgumentException("proactive.heartbeat.interval-minutes must be positive");
            }
            if (!"runner".equals(mode) && !"ledger".equals(mode)) {
                throw new IllegalArgumentException("proactive.heartbeat.mode must be 'runner' or 'ledger', got " + mode);
            }
        }

        public boolean ledgerMode() {
            return "ledger".equals(mode);
        }
    }

    /**
     * @param ownerChannel name of the channel that reaches the owner
     */
    public record DeliveryConfig(String ownerChannel) {
        public DeliveryConfig {
            if (ownerChannel == null || ownerChannel.isBlank()) ownerChannel = "rest";
        }
    }

    /**
     * @param enabled whether the Telegram channel is registered
     * @param token   bot token
     * @param chatId  the owner's chat id
     */
    public record TelegramConfig(Boolean enabled, String token, Long chatId) {
        public TelegramConfig {
            if (enabled == null) enabled = false;
            if (chatId == null) chatId = 0L;
        }
    }
}
