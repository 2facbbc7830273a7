package com.delayq.recurrence;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a recurring job is due. A recurring job is described by its
 * {@code period} (seconds between runs), an optional {@code at} time of day and an
 * optional {@code stopAt} expiry.
 */
public final class RecurrenceEvaluator {

    private static final Pattern HOUR_AND_MINUTE = Pattern.compile("(\\d{1,2}):(\\d\\d)");
    private static final Pattern ANY_HOUR_AND_MINUTE = Pattern.compile("\\*{1,2}:(\\d\\d)");

    private RecurrenceEvaluator() {
    }

    /**
     * Parses an {@code at} value.
     *
     * @return the parsed time of day, or empty when {@code spec} is null or blank
     * @throws InvalidTimeSpecException if {@code spec} is present but malformed
     */
    public static Optional<TimeOfDay> parseTimeSpec(String spec) {
        if (spec == null || spec.isBlank()) {
            return Optional.empty();
        }

        Matcher hourAndMinute = HOUR_AND_MINUTE.matcher(spec);
        if (hourAndMinute.matches()) {
            int hour = Integer.parseInt(hourAndMinute.group(1));
            int minute = Integer.parseInt(hourAndMinute.group(2));
            if (hour >= 24 || minute >= 60) {
                throw new InvalidTimeSpecException(spec);
            }
            return Optional.of(TimeOfDay.dailyAt(hour, minute));
        }

        Matcher anyHour = ANY_HOUR_AND_MINUTE.matcher(spec);
        if (anyHour.matches()) {
            int minute = Integer.parseInt(anyHour.group(1));
            if (minute >= 60) {
                throw new InvalidTimeSpecException(spec);
            }
            return Optional.of(TimeOfDay.everyHourAt(minute));
        }

        throw new InvalidTimeSpecException(spec);
    }

    /**
     * A job is due when
     * <ul>
     * <li>it never ran, or at least {@code periodSeconds} whole seconds passed since {@code lastRunAt}</li>
     * <li>{@code now} falls on the {@code at} minute, if one is set</li>
     * <li>{@code stopAt}, if set, is strictly after {@code now}</li>
     * </ul>
     *
     * @throws InvalidTimeSpecException if {@code at} is malformed
     */
    public static boolean isDue(
            OffsetDateTime lastRunAt,
            OffsetDateTime now,
            Integer periodSeconds,
            String at,
            OffsetDateTime stopAt) {
        Optional<TimeOfDay> timeOfDay = parseTimeSpec(at);

        boolean elapsed = lastRunAt == null
                || ChronoUnit.SECONDS.between(lastRunAt, now) >= (periodSeconds == null ? 0 : periodSeconds);
        boolean onTime = timeOfDay.map(t -> t.matches(now)).orElse(true);
        boolean notExpired = stopAt == null || stopAt.isAfter(now);

        return elapsed && onTime && notExpired;
    }
}
