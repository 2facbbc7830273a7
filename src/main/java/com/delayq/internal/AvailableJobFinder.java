package com.delayq.internal;

import com.delayq.Job;
import com.delayq.PriorityBounds;
import com.delayq.recurrence.InvalidTimeSpecException;
import com.delayq.recurrence.RecurrenceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Selects the jobs a worker should try to lock next. Structural eligibility is
 * decided by the store; recurring jobs are then kept only if they are due.
 */
@Component
public class AvailableJobFinder {

    private static final Logger log = LoggerFactory.getLogger(AvailableJobFinder.class);

    private final JobStore jobStore;

    public AvailableJobFinder(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    /**
     * Returns up to {@code limit} candidates in priority order. The result is a small
     * over-fetch: some of them will usually be locked by other workers first.
     */
    public List<Job> findAvailable(String workerName, int limit, Duration maxRunTime, PriorityBounds bounds) {
        OffsetDateTime now = jobStore.now();
        CandidateQuery query = new CandidateQuery(workerName, now, now.minus(maxRunTime), bounds, limit);

        List<Job> candidates = jobStore.findCandidates(query);
        List<Job> available = new ArrayList<>(candidates.size());
        for (Job job : candidates) {
            if (!job.isPeriodic() || isDue(job, now)) {
                available.add(job);
            }
        }
        return available;
    }

    private boolean isDue(Job job, OffsetDateTime now) {
        try {
            return RecurrenceEvaluator.isDue(job.getLastRunAt(), now, job.getPeriod(), job.getAt(), job.getStopAt());
        } catch (InvalidTimeSpecException e) {
            log.error("Skipping recurring job {} of type {}: malformed at '{}'", job.getId(), job.getType(),
                    e.getSpec());
            return false;
        }
    }
}
