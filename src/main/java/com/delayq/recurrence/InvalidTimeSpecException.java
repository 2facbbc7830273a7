package com.delayq.recurrence;

/**
 * Thrown when an {@code at} value is neither {@code H:MM}/{@code HH:MM} nor
 * {@code *:MM}/{@code **:MM}, or when its hour or minute is out of range.
 */
public class InvalidTimeSpecException extends IllegalArgumentException {

    private final String spec;

    public InvalidTimeSpecException(String spec) {
        super("Invalid time of day '" + spec + "'. Expected H:MM, HH:MM, *:MM or **:MM");
        this.spec = spec;
    }

    public String getSpec() {
        return spec;
    }
}
