package com.delayq.internal;

import com.delayq.JobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

public class DelayQMetrics {

    private static final Logger log = LoggerFactory.getLogger(DelayQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Object snapshotMonitor = new Object();

    private volatile QueueSnapshot cachedSnapshot = QueueSnapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public DelayQMetrics(JobRepository jobRepository, MeterRegistry meterRegistry, Clock clock) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering DelayQ gauges...");

        for (State state : State.values()) {
            Gauge.builder("delayq.jobs.count", this, metrics -> metrics.countFor(state))
                    .description("Number of DelayQ jobs")
                    .tag("state", state.name())
                    .register(meterRegistry);
        }

        Gauge.builder("delayq.jobs.total", this, DelayQMetrics::totalCount)
                .description("Total number of DelayQ jobs in the database")
                .register(meterRegistry);
    }

    private double countFor(State state) {
        QueueSnapshot snapshot = getSnapshot();
        return switch (state) {
            case READY -> snapshot.readyCount();
            case LOCKED -> snapshot.lockedCount();
            case FAILED -> snapshot.failedCount();
        };
    }

    private double totalCount() {
        QueueSnapshot snapshot = getSnapshot();
        return snapshot.readyCount() + snapshot.lockedCount() + snapshot.failedCount();
    }

    private QueueSnapshot getSnapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private QueueSnapshot loadSnapshot() {
        try {
            JobRepository.QueueCounts counts = jobRepository.countQueueStates(OffsetDateTime.now(clock));
            return new QueueSnapshot(
                    countOrZero(counts.getReadyCount()),
                    countOrZero(counts.getLockedCount()),
                    countOrZero(counts.getFailedCount()));
        } catch (Exception e) {
            log.trace("Failed to query queue counts for metrics: {}", e.getMessage());
            return QueueSnapshot.empty();
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private enum State {
        READY,
        LOCKED,
        FAILED
    }

    private record QueueSnapshot(long readyCount, long lockedCount, long failedCount) {
        private static QueueSnapshot empty() {
            return new QueueSnapshot(0, 0, 0);
        }
    }
}
