package com.delayq.internal;

import com.delayq.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JobLockerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-02T09:30:00Z");
    private static final Duration MAX_RUN_TIME = Duration.ofHours(4);
    private static final String WORKER = "host:a pid:1";
    private static final String OTHER_WORKER = "host:b pid:2";

    private InMemoryJobStore store;
    private JobLocker locker;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore(NOW);
        locker = new JobLocker(store);
    }

    @Test
    void shouldLockUnlockedJobAndUpdateInMemoryCopy() {
        Job job = store.insert(job(NOW.minusMinutes(1)));

        assertThat(locker.lockExclusively(job, MAX_RUN_TIME, WORKER)).isTrue();

        assertThat(job.getLockedBy()).isEqualTo(WORKER);
        assertThat(job.getLockedAt()).isEqualTo(NOW);
        assertThat(job.getLastRunAt()).isEqualTo(NOW);
        Job row = store.row(job.getId());
        assertThat(row.getLockedBy()).isEqualTo(WORKER);
        assertThat(row.getLockedAt()).isEqualTo(NOW);
        assertThat(row.getLastRunAt()).isEqualTo(NOW);
    }

    @Test
    void shouldLoseWhenAnotherWorkerLockedTheRowAfterSelection() {
        Job job = store.insert(job(NOW.minusMinutes(1)));
        Job staleSnapshot = store.row(job.getId());

        assertThat(locker.lockExclusively(job, MAX_RUN_TIME, OTHER_WORKER)).isTrue();
        assertThat(locker.lockExclusively(staleSnapshot, MAX_RUN_TIME, WORKER)).isFalse();

        assertThat(staleSnapshot.getLockedBy()).isNull();
        assertThat(store.row(job.getId()).getLockedBy()).isEqualTo(OTHER_WORKER);
    }

    @Test
    void shouldTakeOverExpiredLock() {
        Job job = job(NOW.minusHours(6));
        job.setLockedBy(OTHER_WORKER);
        job.setLockedAt(NOW.minusHours(5));
        store.insert(job);

        assertThat(locker.lockExclusively(job, MAX_RUN_TIME, WORKER)).isTrue();
        assertThat(store.row(job.getId()).getLockedBy()).isEqualTo(WORKER);
    }

    @Test
    void shouldNotTakeOverLockThatIsStillFresh() {
        Job job = job(NOW.minusHours(6));
        job.setLockedBy(OTHER_WORKER);
        job.setLockedAt(NOW.minusHours(3));
        store.insert(job);

        assertThat(locker.lockExclusively(job, MAX_RUN_TIME, WORKER)).isFalse();
        assertThat(job.getLockedBy()).isEqualTo(OTHER_WORKER);
    }

    @Test
    void shouldNotLockJobScheduledInTheFuture() {
        Job job = store.insert(job(NOW.plusSeconds(1)));

        assertThat(locker.lockExclusively(job, MAX_RUN_TIME, WORKER)).isFalse();
        assertThat(store.row(job.getId()).getLockedAt()).isNull();
    }

    @Test
    void shouldRefreshOwnLockRegardlessOfRunAt() {
        Job job = job(NOW.plusHours(2));
        job.setLockedBy(WORKER);
        job.setLockedAt(NOW.minusMinutes(10));
        store.insert(job);
        store.advance(Duration.ofSeconds(30));

        assertThat(locker.lockExclusively(job, MAX_RUN_TIME, WORKER)).isTrue();

        OffsetDateTime later = NOW.plusSeconds(30);
        assertThat(job.getLockedAt()).isEqualTo(later);
        assertThat(store.row(job.getId()).getLockedAt()).isEqualTo(later);
        assertThat(store.row(job.getId()).getLastRunAt()).isEqualTo(later);
    }

    @Test
    void shouldFailToRefreshOwnLockOnceTakenOver() {
        Job job = job(NOW.minusHours(6));
        job.setLockedBy(WORKER);
        job.setLockedAt(NOW.minusHours(5));
        store.insert(job);
        Job mySnapshot = store.row(job.getId());

        assertThat(locker.lockExclusively(job, MAX_RUN_TIME, OTHER_WORKER)).isTrue();
        assertThat(locker.lockExclusively(mySnapshot, MAX_RUN_TIME, WORKER)).isFalse();
    }

    @Test
    void shouldGrantLockToExactlyOneOfManyConcurrentWorkers() throws Exception {
        Job job = store.insert(job(NOW.minusMinutes(1)));
        int workers = 16;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String name = "host:w pid:" + i;
                Job snapshot = store.row(job.getId());
                Callable<Boolean> attempt = () -> {
                    start.await();
                    return locker.lockExclusively(snapshot, MAX_RUN_TIME, name);
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(store.row(job.getId()).getLockedBy()).startsWith("host:w pid:");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldClearOnlyLocksOfTheGivenWorker() {
        Job mine = store.insert(job(NOW.minusMinutes(1)));
        Job theirs = store.insert(job(NOW.minusMinutes(1)));
        locker.lockExclusively(mine, MAX_RUN_TIME, WORKER);
        locker.lockExclusively(theirs, MAX_RUN_TIME, OTHER_WORKER);

        assertThat(locker.clearLocks(WORKER)).isEqualTo(1);

        assertThat(store.row(mine.getId()).getLockedBy()).isNull();
        assertThat(store.row(mine.getId()).getLockedAt()).isNull();
        assertThat(store.row(theirs.getId()).getLockedBy()).isEqualTo(OTHER_WORKER);
        assertThat(locker.clearLocks(WORKER)).isZero();
        assertThat(locker.clearLocks("host:nobody pid:0")).isZero();
    }

    private static Job job(OffsetDateTime runAt) {
        Job job = new Job(UUID.randomUUID(), "REPORT", null, 0);
        job.setRunAt(runAt);
        return job;
    }
}
