package com.delayq.internal;

import com.delayq.Job;
import com.delayq.JobRepository;
import com.delayq.JobWorker;
import com.delayq.PriorityBounds;
import com.delayq.config.DelayQProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-threaded worker loop: find candidates, lock the first one this worker can
 * win, perform it, record the outcome, repeat. Every outcome write is guarded by
 * {@code locked_by}, so a worker whose lock was taken over changes nothing.
 */
@Component
@ConditionalOnProperty(prefix = "delayq.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobPoller {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private final AvailableJobFinder jobFinder;
    private final JobLocker jobLocker;
    private final JobRepository jobRepository;
    private final List<JobWorker<?>> workers;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final String workerName;
    private final Duration maxRunTime;
    private final PriorityBounds priorityBounds;
    private final int readAhead;
    private final int maxAttempts;
    private final int maxJobsPerPoll;

    private Map<String, JobWorker<?>> workersByType = Map.of();

    public JobPoller(
            AvailableJobFinder jobFinder,
            JobLocker jobLocker,
            JobRepository jobRepository,
            List<JobWorker<?>> workers,
            ObjectMapper delayqObjectMapper,
            Clock delayqClock,
            DelayQProperties properties) {
        this.jobFinder = jobFinder;
        this.jobLocker = jobLocker;
        this.jobRepository = jobRepository;
        this.workers = workers;
        this.objectMapper = delayqObjectMapper;
        this.clock = delayqClock;

        DelayQProperties.Worker worker = properties.getWorker();
        this.workerName = worker.getName();
        this.maxRunTime = worker.getMaxRunTime();
        this.priorityBounds = worker.getPriorityBounds();
        this.readAhead = Math.max(1, worker.getReadAhead());
        this.maxAttempts = Math.max(1, worker.getMaxAttempts());
        this.maxJobsPerPoll = Math.max(1, worker.getMaxJobsPerPoll());
    }

    @PostConstruct
    public void init() {
        Map<String, JobWorker<?>> registrations = new LinkedHashMap<>();
        for (JobWorker<?> worker : workers) {
            String jobType = worker.getJobType() == null ? "" : worker.getJobType().trim();
            if (jobType.isEmpty()) {
                throw new IllegalStateException(
                        "JobWorker " + ClassUtils.getUserClass(worker).getName() + " returned a blank job type");
            }
            JobWorker<?> existing = registrations.putIfAbsent(jobType, worker);
            if (existing != null) {
                throw new IllegalStateException("Duplicate job type '" + jobType + "' on "
                        + ClassUtils.getUserClass(existing).getName() + " and "
                        + ClassUtils.getUserClass(worker).getName());
            }
        }
        this.workersByType = Map.copyOf(registrations);

        log.info("Job poller started as '{}' with {} registered job types: {}", workerName, workersByType.size(),
                workersByType.keySet());
    }

    @Scheduled(fixedDelayString = "${delayq.worker.poll-interval-in-seconds:5}000")
    public void poll() {
        try {
            int performed = workOff(maxJobsPerPoll);
            if (performed > 0) {
                log.debug("Worker {} performed {} job(s) this poll", workerName, performed);
            }
        } catch (DataAccessException e) {
            log.error("Polling failed for worker {}; retrying on the next poll", workerName, e);
        }
    }

    /**
     * Performs up to {@code maxJobs} jobs, stopping early when nothing can be locked.
     *
     * @return number of jobs performed
     */
    public int workOff(int maxJobs) {
        int performed = 0;
        while (performed < maxJobs && reserveAndRunOneJob()) {
            performed++;
        }
        return performed;
    }

    boolean reserveAndRunOneJob() {
        List<Job> candidates = jobFinder.findAvailable(workerName, readAhead, maxRunTime, priorityBounds);
        for (Job job : candidates) {
            if (jobLocker.lockExclusively(job, maxRunTime, workerName)) {
                run(job);
                return true;
            }
        }
        return false;
    }

    private void run(Job job) {
        JobWorker<?> worker = workersByType.get(job.getType());
        try {
            if (worker == null) {
                throw new IllegalStateException("No JobWorker registered for job type '" + job.getType() + "'");
            }
            Object payload = deserialize(worker, job.getPayload());
            perform(worker, job, payload);
        } catch (Exception e) {
            log.error("Job {} of type {} failed on attempt {}", job.getId(), job.getType(), job.getAttempts() + 1, e);
            onFailure(job, e);
            return;
        }
        onSuccess(job);
    }

    private Object deserialize(JobWorker<?> worker, JsonNode rawPayload) throws Exception {
        Class<?> payloadClass = worker.getPayloadClass();
        if (rawPayload == null || rawPayload.isNull() || payloadClass == Void.class) {
            return null;
        }
        return objectMapper.treeToValue(rawPayload, payloadClass);
    }

    private void perform(JobWorker<?> worker, Job job, Object payload) throws Exception {
        @SuppressWarnings("unchecked")
        JobWorker<Object> castWorker = (JobWorker<Object>) worker;
        castWorker.perform(job.getId(), payload);
    }

    private void onSuccess(Job job) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = job.isPeriodic()
                ? jobRepository.releaseLock(job.getId(), workerName, nextPeriodicRunAt(job, now), now)
                : jobRepository.deleteLocked(job.getId(), workerName);
        if (updated == 0) {
            log.warn("Job {} finished after its lock was taken over; result not recorded by {}", job.getId(),
                    workerName);
            return;
        }
        log.debug("Completed job {} of type {}", job.getId(), job.getType());
    }

    // One period after the lock of the run that just finished; never earlier than isDue allows.
    static OffsetDateTime nextPeriodicRunAt(Job job, OffsetDateTime now) {
        OffsetDateTime lockedAt = job.getLastRunAt() != null ? job.getLastRunAt() : now;
        return lockedAt.plusSeconds(job.getPeriod());
    }

    private void onFailure(Job job, Exception error) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int attempts = job.getAttempts() + 1;
        String lastError = describe(error);

        int updated;
        if (attempts >= maxAttempts) {
            updated = jobRepository.markFailed(job.getId(), workerName, attempts, lastError, now);
            if (updated > 0) {
                log.warn("Job {} of type {} permanently failed after {} attempts", job.getId(), job.getType(),
                        attempts);
            }
        } else {
            OffsetDateTime nextRunAt = now.plusSeconds(retryDelaySeconds(attempts));
            updated = jobRepository.rescheduleAfterFailure(job.getId(), workerName, attempts, lastError, nextRunAt,
                    now);
        }
        if (updated == 0) {
            log.warn("Could not record failure of job {}: lock no longer held by {}", job.getId(), workerName);
        }
    }

    static long retryDelaySeconds(int attempts) {
        return (long) Math.pow(attempts, 4) + 5;
    }

    private String describe(Exception error) {
        String message = error.getMessage();
        return message == null ? error.getClass().getName() : error.getClass().getName() + ": " + message;
    }

    @PreDestroy
    void releaseLocks() {
        try {
            jobLocker.clearLocks(workerName);
        } catch (DataAccessException e) {
            log.warn("Could not release locks held by {} on shutdown; they expire after {}", workerName,
                    maxRunTime, e);
        }
    }
}
