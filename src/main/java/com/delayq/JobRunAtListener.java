package com.delayq;

import jakarta.persistence.PrePersist;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Gives jobs saved without a run_at the storage clock's current time. Hibernate obtains
 * this listener from the Spring context, so it sees the same {@code delayqClock} as the
 * selector and locker.
 */
@Component
public class JobRunAtListener {

    private final Clock clock;

    public JobRunAtListener(Clock delayqClock) {
        this.clock = delayqClock;
    }

    @PrePersist
    public void setDefaultRunAt(Job job) {
        if (job.getRunAt() == null) {
            job.setRunAt(OffsetDateTime.now(clock));
        }
    }
}
