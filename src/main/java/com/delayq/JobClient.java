package com.delayq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;

@Service
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JobClient(JobRepository jobRepository, ObjectMapper delayqObjectMapper, Clock delayqClock) {
        this.jobRepository = jobRepository;
        this.objectMapper = delayqObjectMapper;
        this.clock = delayqClock;
    }

    /**
     * Enqueue a job to run as soon as possible with priority 0.
     */
    public UUID enqueue(String type, Object payload) {
        return enqueue(type, payload, 0);
    }

    /**
     * Enqueue a job to run as soon as possible. Lower priorities run first.
     */
    public UUID enqueue(String type, Object payload, int priority) {
        return save(newJob(type, payload, priority, null));
    }

    /**
     * Enqueue a job that must not run before {@code runAt}.
     */
    public UUID enqueueAt(String type, Object payload, int priority, OffsetDateTime runAt) {
        return save(newJob(type, payload, priority, normalizeRequiredRunAt(runAt)));
    }

    /**
     * Enqueue a job that must not run before {@code runAt}.
     */
    public UUID enqueueAt(String type, Object payload, int priority, Instant runAt) {
        if (runAt == null) {
            throw new IllegalArgumentException("runAt must not be null");
        }
        return enqueueAt(type, payload, priority, OffsetDateTime.ofInstant(runAt, clock.getZone()));
    }

    /**
     * Enqueue a recurring job. It is eligible immediately and from then on whenever
     * {@code recurrence} says it is due.
     */
    public UUID scheduleRecurring(String type, Object payload, int priority, Recurrence recurrence) {
        return scheduleRecurring(type, payload, priority, recurrence, null);
    }

    /**
     * Like {@link #scheduleRecurring(String, Object, int, Recurrence)}, but at most one
     * non-failed job may carry {@code uniqueKey}. A second insert with the same key is
     * rejected by the database with a {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    public UUID scheduleRecurring(String type, Object payload, int priority, Recurrence recurrence,
            String uniqueKey) {
        if (recurrence == null) {
            throw new IllegalArgumentException("recurrence must not be null");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (recurrence.stopAt() != null && !recurrence.stopAt().isAfter(now)) {
            throw new IllegalArgumentException("stopAt must be in the future");
        }

        Job job = newJob(type, payload, priority, null);
        job.setPeriod(recurrence.periodSeconds());
        job.setAt(recurrence.at());
        job.setStopAt(recurrence.stopAt());
        job.setUniqueKey(uniqueKey == null || uniqueKey.isBlank() ? null : uniqueKey.trim());
        UUID jobId = save(job);
        log.info("Scheduled recurring job {} of type {} every {}s{}", jobId, job.getType(),
                recurrence.periodSeconds(), recurrence.at() == null ? "" : " at " + recurrence.at());
        return jobId;
    }

    private Job newJob(String type, Object payload, int priority, OffsetDateTime runAt) {
        String normalizedType = normalizeRequiredType(type);
        JsonNode jsonNode = payload != null ? objectMapper.valueToTree(payload) : null;
        OffsetDateTime now = OffsetDateTime.now(clock);

        Job job = new Job(UUID.randomUUID(), normalizedType, jsonNode, priority);
        job.setRunAt(runAt != null ? runAt : now);
        job.setUpdatedAt(now);
        return job;
    }

    private UUID save(Job job) {
        jobRepository.save(job);
        log.debug("Enqueued job {} of type {} to run at {}", job.getId(), job.getType(), job.getRunAt());
        return job.getId();
    }

    private String normalizeRequiredType(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Job type must not be null");
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        return trimmed;
    }

    private OffsetDateTime normalizeRequiredRunAt(OffsetDateTime runAt) {
        if (runAt == null) {
            throw new IllegalArgumentException("runAt must not be null");
        }
        return runAt;
    }
}
