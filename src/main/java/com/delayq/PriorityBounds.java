package com.delayq;

/**
 * Inclusive priority range a worker accepts. A null bound is open.
 */
public record PriorityBounds(Integer min, Integer max) {

    private static final PriorityBounds UNBOUNDED = new PriorityBounds(null, null);

    public PriorityBounds {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min priority " + min + " is greater than max priority " + max);
        }
    }

    public static PriorityBounds unbounded() {
        return UNBOUNDED;
    }

    public boolean contains(int priority) {
        return (min == null || priority >= min) && (max == null || priority <= max);
    }

    public int lowest() {
        return min == null ? Integer.MIN_VALUE : min;
    }

    public int highest() {
        return max == null ? Integer.MAX_VALUE : max;
    }
}
