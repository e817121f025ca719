package io.proactive.cron;

import org.jobrunr.scheduling.cron.CronExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Computes when a job runs next. Pure: every call takes an explicit reference instant.
 *
 * <p>Cron expressions have five fields and are evaluated by JobRunr's {@link CronExpression} as
 * wall-clock time in the calculator's zone. When both day-of-month and day-of-week are
 * restricted, a day matches if either one does. One-shot schedules are ISO-8601 instants;
 * timestamps without an offset are read as UTC.</p>
 */
public class NextRunCalculator {

    private static final Logger log = LoggerFactory.getLogger(NextRunCalculator.class);

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");

    private final ZoneId zone;

    public NextRunCalculator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Returns the earliest instant strictly after {@code reference} matching the cron expression.
     *
     * @throws InvalidScheduleException if the expression is malformed or never fires
     */
    public Instant computeNextRun(String cronExpression, Instant reference) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is empty");
        }
        String[] fields = cronExpression.trim().toUpperCase(Locale.ROOT).split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleException(
                    "Cron expression must have 5 fields, got %d: %s".formatted(fields.length, cronExpression));
        }
        if (isWildcard(fields[2]) || isWildcard(fields[4])) {
            return next(String.join(" ", fields), cronExpression, reference);
        }

        // both day fields restricted: the earlier of the two single-field schedules wins
        String byDayOfMonth = String.join(" ", fields[0], fields[1], fields[2], fields[3], "*");
        String byDayOfWeek = String.join(" ", fields[0], fields[1], "*", fields[3], fields[4]);
        Instant viaDayOfWeek = next(byDayOfWeek, cronExpression, reference);
        // a malformed day-of-month must fail here, not fall back below
        next(String.join(" ", fields[0], fields[1], fields[2], "*", "*"), cronExpression, reference);
        Instant viaDayOfMonth;
        try {
            viaDayOfMonth = next(byDayOfMonth, cronExpression, reference);
        } catch (InvalidScheduleException e) {
            log.debug("Day-of-month part of '{}' never fires, using day-of-week only", cronExpression);
            return viaDayOfWeek;
        }
        return viaDayOfMonth.isBefore(viaDayOfWeek) ? viaDayOfMonth : viaDayOfWeek;
    }

    private Instant next(String expression, String original, Instant reference) {
        Instant next;
        try {
            next = CronExpression.create(expression).next(reference, reference, zone);
        } catch (RuntimeException e) {
            throw new InvalidScheduleException("Invalid cron expression '%s': %s".formatted(original, e.getMessage()), e);
        }
        if (next == null || !next.isAfter(reference)) {
            throw new InvalidScheduleException("Cron expression never fires: " + original);
        }
        return next;
    }

    private static boolean isWildcard(String field) {
        return field.equals("*") || field.equals("?");
    }

    /**
     * Parses a one-shot schedule.
     *
     * @throws InvalidScheduleException if the timestamp is not ISO-8601
     */
    public Instant parseOneShot(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            throw new InvalidScheduleException("Invalid ISO timestamp: " + timestamp);
        }
        String raw = timestamp.trim();
        try {
            return OffsetDateTime.parse(normalizeUtcIso(raw)).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleException("Invalid ISO timestamp: " + raw, e);
        }
    }

    /**
     * Returns the first {@code next_run_at} for a new job, validating its schedule on the way.
     */
    public Instant initialNextRun(JobType jobType, String schedule, Instant reference) {
        return switch (jobType) {
            case RECURRING -> computeNextRun(schedule, reference);
            case ONE_SHOT -> parseOneShot(schedule);
        };
    }

    /**
     * Appends a UTC designator to date-only and offset-less date-time strings.
     */
    static String normalizeUtcIso(String raw) {
        if (ISO_DATE_RE.matcher(raw).matches()) return raw + "T00:00:00Z";
        if (ISO_TZ_RE.matcher(raw).find()) return raw;
        if (ISO_DATE_TIME_RE.matcher(raw).find()) return raw + "Z";
        return raw;
    }
}
