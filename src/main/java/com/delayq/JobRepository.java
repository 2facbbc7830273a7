package com.delayq;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Queue counters fetched in a single query.
     */
    interface QueueCounts {
        Long getReadyCount();

        Long getLockedCount();

        Long getFailedCount();
    }

    /**
     * Jobs a worker may try to lock: not failed, due and unlocked (or holding a stale
     * lock), or already locked by the same worker.
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.failedAt IS NULL
              AND ((j.runAt <= :now AND (j.lockedAt IS NULL OR j.lockedAt < :lockExpiredBefore))
                   OR j.lockedBy = :workerName)
              AND j.priority >= :minPriority
              AND j.priority <= :maxPriority
            ORDER BY j.priority ASC, j.runAt ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findCandidates(
            @Param("workerName") String workerName,
            @Param("now") OffsetDateTime now,
            @Param("lockExpiredBefore") OffsetDateTime lockExpiredBefore,
            @Param("minPriority") int minPriority,
            @Param("maxPriority") int maxPriority,
            Pageable pageable);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.lockedAt = :now,
                j.lockedBy = :workerName,
                j.lastRunAt = :now
            WHERE j.id = :id
              AND (j.lockedAt IS NULL OR j.lockedAt < :lockExpiredBefore)
              AND j.runAt <= :now
            """)
    int lockUnowned(
            @Param("id") UUID id,
            @Param("workerName") String workerName,
            @Param("now") OffsetDateTime now,
            @Param("lockExpiredBefore") OffsetDateTime lockExpiredBefore);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.lockedAt = :now,
                j.lastRunAt = :now
            WHERE j.id = :id
              AND j.lockedBy = :workerName
            """)
    int relockOwned(
            @Param("id") UUID id,
            @Param("workerName") String workerName,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("UPDATE Job j SET j.lockedBy = NULL, j.lockedAt = NULL WHERE j.lockedBy = :workerName")
    int clearLocks(@Param("workerName") String workerName);

    @Modifying
    @Transactional
    @Query("DELETE FROM Job j WHERE j.id = :id AND j.lockedBy = :workerName")
    int deleteLocked(@Param("id") UUID id, @Param("workerName") String workerName);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.lockedAt = NULL,
                j.lockedBy = NULL,
                j.attempts = 0,
                j.lastError = NULL,
                j.runAt = :nextRunAt,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.lockedBy = :workerName
            """)
    int releaseLock(
            @Param("id") UUID id,
            @Param("workerName") String workerName,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.lockedAt = NULL,
                j.lockedBy = NULL,
                j.attempts = :attempts,
                j.lastError = :lastError,
                j.runAt = :nextRunAt,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.lockedBy = :workerName
            """)
    int rescheduleAfterFailure(
            @Param("id") UUID id,
            @Param("workerName") String workerName,
            @Param("attempts") int attempts,
            @Param("lastError") String lastError,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.lockedAt = NULL,
                j.lockedBy = NULL,
                j.attempts = :attempts,
                j.lastError = :lastError,
                j.failedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.lockedBy = :workerName
            """)
    int markFailed(
            @Param("id") UUID id,
            @Param("workerName") String workerName,
            @Param("attempts") int attempts,
            @Param("lastError") String lastError,
            @Param("now") OffsetDateTime now);

    @Query("""
            SELECT
              COALESCE(SUM(CASE
                WHEN j.failedAt IS NULL AND j.lockedAt IS NULL AND j.runAt <= :now
                THEN 1 ELSE 0 END), 0) AS readyCount,
              COALESCE(SUM(CASE
                WHEN j.failedAt IS NULL AND j.lockedAt IS NOT NULL
                THEN 1 ELSE 0 END), 0) AS lockedCount,
              COALESCE(SUM(CASE
                WHEN j.failedAt IS NOT NULL
                THEN 1 ELSE 0 END), 0) AS failedCount
            FROM Job j
            """)
    QueueCounts countQueueStates(@Param("now") OffsetDateTime now);

    boolean existsByTypeAndFailedAtIsNull(String type);

    @Modifying
    @Transactional
    int deleteByFailedAtBefore(OffsetDateTime failedAt);
}
