package com.delayq.internal;

import com.delayq.Job;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Storage operations the scheduling core relies on. Each update must check its
 * match condition and write in one atomic step, and report how many rows it changed.
 * Storage failures propagate as unchecked exceptions.
 */
public interface JobStore {

    /**
     * Current time on the storage clock. Every worker must share the same clock basis.
     */
    OffsetDateTime now();

    /**
     * Non-failed jobs that are due and unlocked (or stale), or already locked by
     * {@code query.workerName()}, within the priority bounds, ordered by priority then
     * run_at.
     */
    List<Job> findCandidates(CandidateQuery query);

    /**
     * Takes the lock for {@code workerName} only if the job is still unlocked or its lock
     * predates {@code lockExpiredBefore}, and its run_at has been reached.
     */
    int lockUnowned(UUID jobId, String workerName, OffsetDateTime now, OffsetDateTime lockExpiredBefore);

    /**
     * Refreshes a lock {@code workerName} already holds.
     */
    int relockOwned(UUID jobId, String workerName, OffsetDateTime now);

    /**
     * Releases every lock held by {@code workerName}.
     */
    int clearLocks(String workerName);
}
