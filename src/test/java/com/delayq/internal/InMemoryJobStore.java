package com.delayq.internal;

import com.delayq.Job;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Job table kept in memory. Every method is synchronized, which gives each conditional
 * update the same all-or-nothing behaviour a database row update has. Callers only
 * ever see copies of the stored rows.
 */
class InMemoryJobStore implements JobStore {

    private final Map<UUID, Job> rows = new LinkedHashMap<>();
    private OffsetDateTime now;

    InMemoryJobStore(OffsetDateTime now) {
        this.now = now;
    }

    synchronized void advance(Duration duration) {
        now = now.plus(duration);
    }

    synchronized Job insert(Job job) {
        if (job.getId() == null) {
            job.setId(UUID.randomUUID());
        }
        if (job.getRunAt() == null) {
            job.setRunAt(now);
        }
        rows.put(job.getId(), copy(job));
        return job;
    }

    synchronized Job row(UUID id) {
        return copy(rows.get(id));
    }

    synchronized List<Job> all() {
        return rows.values().stream().map(InMemoryJobStore::copy).toList();
    }

    @Override
    public synchronized OffsetDateTime now() {
        return now;
    }

    @Override
    public synchronized List<Job> findCandidates(CandidateQuery query) {
        List<Job> matches = new ArrayList<>();
        for (Job job : rows.values()) {
            boolean unlockedOrStale = job.getLockedAt() == null || job.getLockedAt().isBefore(query.lockExpiredBefore());
            boolean ready = !job.getRunAt().isAfter(query.now()) && unlockedOrStale;
            boolean ownLock = query.workerName().equals(job.getLockedBy());
            if (job.getFailedAt() == null && (ready || ownLock) && query.bounds().contains(job.getPriority())) {
                matches.add(copy(job));
            }
        }
        matches.sort(Comparator.comparingInt(Job::getPriority).thenComparing(Job::getRunAt));
        return matches.size() > query.limit() ? new ArrayList<>(matches.subList(0, query.limit())) : matches;
    }

    @Override
    public synchronized int lockUnowned(UUID jobId, String workerName, OffsetDateTime now,
            OffsetDateTime lockExpiredBefore) {
        Job job = rows.get(jobId);
        if (job == null
                || !(job.getLockedAt() == null || job.getLockedAt().isBefore(lockExpiredBefore))
                || job.getRunAt().isAfter(now)) {
            return 0;
        }
        job.setLockedAt(now);
        job.setLockedBy(workerName);
        job.setLastRunAt(now);
        return 1;
    }

    @Override
    public synchronized int relockOwned(UUID jobId, String workerName, OffsetDateTime now) {
        Job job = rows.get(jobId);
        if (job == null || !workerName.equals(job.getLockedBy())) {
            return 0;
        }
        job.setLockedAt(now);
        job.setLastRunAt(now);
        return 1;
    }

    @Override
    public synchronized int clearLocks(String workerName) {
        int released = 0;
        for (Job job : rows.values()) {
            if (workerName.equals(job.getLockedBy())) {
                job.setLockedBy(null);
                job.setLockedAt(null);
                released++;
            }
        }
        return released;
    }

    private static Job copy(Job source) {
        if (source == null) {
            return null;
        }
        Job job = new Job(source.getId(), source.getType(), source.getPayload(), source.getPriority());
        job.setAttempts(source.getAttempts());
        job.setLastError(source.getLastError());
        job.setRunAt(source.getRunAt());
        job.setLockedAt(source.getLockedAt());
        job.setLockedBy(source.getLockedBy());
        job.setFailedAt(source.getFailedAt());
        job.setLastRunAt(source.getLastRunAt());
        job.setPeriod(source.getPeriod());
        job.setAt(source.getAt());
        job.setStopAt(source.getStopAt());
        return job;
    }
}
