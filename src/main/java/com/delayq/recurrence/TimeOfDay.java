package com.delayq.recurrence;

import java.time.OffsetDateTime;

/**
 * A parsed {@code at} constraint. A null {@code hour} is the {@code *:MM} wildcard
 * and matches every hour.
 */
public record TimeOfDay(Integer hour, int minute) {

    public static TimeOfDay everyHourAt(int minute) {
        return new TimeOfDay(null, minute);
    }

    public static TimeOfDay dailyAt(int hour, int minute) {
        return new TimeOfDay(hour, minute);
    }

    public boolean isWildcardHour() {
        return hour == null;
    }

    public boolean matches(OffsetDateTime time) {
        return (hour == null || time.getHour() == hour) && time.getMinute() == minute;
    }
}
