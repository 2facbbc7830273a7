package com.delayq;

import com.delayq.recurrence.RecurrenceEvaluator;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * How often a recurring job runs: at most once per {@code periodSeconds}, optionally
 * only on the {@code at} minute, and never after {@code stopAt}.
 */
public record Recurrence(int periodSeconds, String at, OffsetDateTime stopAt) {

    public Recurrence {
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("periodSeconds must be > 0");
        }
        if (at != null && at.isBlank()) {
            at = null;
        }
        RecurrenceEvaluator.parseTimeSpec(at);
    }

    public static Recurrence every(Duration period) {
        return new Recurrence(Math.toIntExact(period.toSeconds()), null, null);
    }

    public Recurrence at(String timeOfDay) {
        return new Recurrence(periodSeconds, timeOfDay, stopAt);
    }

    public Recurrence until(OffsetDateTime stopAt) {
        return new Recurrence(periodSeconds, at, stopAt);
    }
}
