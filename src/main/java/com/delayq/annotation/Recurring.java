package com.delayq.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link com.delayq.JobWorker} whose job should always exist as a recurring
 * job. On startup one job of the worker's type is created unless a non-failed one is
 * already queued.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Recurring {

    /**
     * Minimum number of seconds between two runs.
     */
    int periodSeconds();

    /**
     * Optional time of day: {@code "HH:MM"} to run at that minute of a given hour,
     * {@code "*:MM"} to run at that minute of every hour.
     */
    String at() default "";

    /**
     * Queue priority; lower values run first.
     */
    int priority() default 0;
}
