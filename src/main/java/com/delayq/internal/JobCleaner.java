package com.delayq.internal;

import com.delayq.JobRepository;
import com.delayq.config.DelayQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Deletes permanently failed jobs once they are older than
 * {@code delayq.worker.delete-failed-jobs-after}. Failed jobs are kept when it is unset.
 */
@Component
@ConditionalOnProperty(prefix = "delayq.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobCleaner.class);
    private final JobRepository jobRepository;
    private final DelayQProperties properties;
    private final Clock clock;

    public JobCleaner(JobRepository jobRepository, DelayQProperties properties, Clock delayqClock) {
        this.jobRepository = jobRepository;
        this.properties = properties;
        this.clock = delayqClock;
    }

    @Scheduled(fixedDelay = 3600000)
    public void cleanup() {
        String retentionStr = properties.getWorker().getDeleteFailedJobsAfter();
        if (retentionStr == null || retentionStr.isBlank()) {
            return;
        }

        try {
            Duration retention = parseDuration(retentionStr);
            OffsetDateTime threshold = OffsetDateTime.now(clock).minus(retention);
            int deleted = jobRepository.deleteByFailedAtBefore(threshold);
            if (deleted > 0) {
                log.info("Deleted {} failed jobs older than {}", deleted, retention);
            }
        } catch (Exception e) {
            log.error("Failed to clean up failed jobs", e);
        }
    }

    static Duration parseDuration(String durationStr) {
        String trimmed = durationStr.trim();
        try {
            return Duration.parse(trimmed);
        } catch (DateTimeParseException notIso) {
            log.trace("'{}' is not an ISO-8601 duration, trying shorthand", trimmed);
        }

        // Shorthand such as "36h" or "7d".
        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        if (shorthand.endsWith("h")) {
            return Duration.ofHours(Long.parseLong(shorthand.substring(0, shorthand.length() - 1)));
        } else if (shorthand.endsWith("d")) {
            return Duration.ofDays(Long.parseLong(shorthand.substring(0, shorthand.length() - 1)));
        }
        throw new IllegalArgumentException("Unsupported duration value: " + durationStr);
    }
}
