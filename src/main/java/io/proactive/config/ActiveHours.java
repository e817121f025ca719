package io.proactive.config;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Half-open hour-of-day window {@code [start, end)} during which proactive work may run.
 * A window with {@code start > end} wraps past midnight; {@code start == end} is never active.
 */
public record ActiveHours(int start, int end, ZoneId zone) {

    public static ActiveHours always(ZoneId zone) {
        return new ActiveHours(0, 24, zone);
    }

    public static ActiveHours from(ProactiveProperties properties) {
        var hours = properties.activeHours();
        return new ActiveHours(hours.start(), hours.end(), properties.zoneId());
    }

    public boolean isActive(Instant instant) {
        int hour = instant.atZone(zone).getHour();
        if (start < end) {
            return hour >= start && hour < end;
        }
        if (start > end) {
            return hour >= start || hour < end;
        }
        return false;
    }

    @Override
    public String toString() {
        return "%02d:00-%02d:00 %s".formatted(start, end, zone);
    }
}
