package com.delayq.internal;

import com.delayq.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Claims jobs for a worker through conditional updates. Mutual exclusion comes only
 * from the row-level atomicity of those updates; nothing is locked in-process.
 * <p>
 * A lock older than {@code maxRunTime} is treated as abandoned and can be taken by
 * another worker, so {@code maxRunTime} must be longer than the slowest job.
 */
@Component
public class JobLocker {

    private static final Logger log = LoggerFactory.getLogger(JobLocker.class);

    private final JobStore jobStore;

    public JobLocker(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    /**
     * Tries to lock {@code job} for {@code workerName}.
     *
     * @return true if exactly one row was updated, in which case {@code job} now carries
     *         the new lockedAt, lockedBy and lastRunAt; false if another worker got there
     *         first
     */
    public boolean lockExclusively(Job job, Duration maxRunTime, String workerName) {
        OffsetDateTime now = jobStore.now();

        int affectedRows;
        if (!workerName.equals(job.getLockedBy())) {
            affectedRows = jobStore.lockUnowned(job.getId(), workerName, now, now.minus(maxRunTime));
        } else {
            // Already ours, e.g. picked up again after this worker restarted.
            affectedRows = jobStore.relockOwned(job.getId(), workerName, now);
        }

        if (affectedRows == 1) {
            job.markLocked(now, workerName);
            log.debug("Worker {} locked job {} of type {}", workerName, job.getId(), job.getType());
            return true;
        }
        log.debug("Worker {} lost the race for job {}", workerName, job.getId());
        return false;
    }

    /**
     * Releases all locks held by {@code workerName}. Safe to call when it holds none.
     */
    public int clearLocks(String workerName) {
        int released = jobStore.clearLocks(workerName);
        if (released > 0) {
            log.info("Released {} job lock(s) held by {}", released, workerName);
        }
        return released;
    }
}
