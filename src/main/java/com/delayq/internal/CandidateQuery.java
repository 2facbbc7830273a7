package com.delayq.internal;

import com.delayq.PriorityBounds;

import java.time.OffsetDateTime;

/**
 * Everything the storage layer needs to select lock candidates for one worker.
 *
 * @param workerName        identity of the polling worker; its own locks are always visible
 * @param now               storage clock reading taken for this poll
 * @param lockExpiredBefore locks acquired before this instant are stale
 * @param bounds            accepted priority range
 * @param limit             maximum number of rows to return
 */
public record CandidateQuery(
        String workerName,
        OffsetDateTime now,
        OffsetDateTime lockExpiredBefore,
        PriorityBounds bounds,
        int limit) {

    public CandidateQuery {
        if (workerName == null || workerName.isBlank()) {
            throw new IllegalArgumentException("workerName must not be blank");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (bounds == null) {
            bounds = PriorityBounds.unbounded();
        }
    }
}
