package com.delayq.internal;

import com.delayq.Job;
import com.delayq.JobRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Component
public class JpaJobStore implements JobStore {

    private final JobRepository jobRepository;
    private final Clock clock;

    public JpaJobStore(JobRepository jobRepository, Clock delayqClock) {
        this.jobRepository = jobRepository;
        this.clock = delayqClock;
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    @Override
    public List<Job> findCandidates(CandidateQuery query) {
        return jobRepository.findCandidates(
                query.workerName(),
                query.now(),
                query.lockExpiredBefore(),
                query.bounds().lowest(),
                query.bounds().highest(),
                PageRequest.of(0, query.limit()));
    }

    @Override
    public int lockUnowned(UUID jobId, String workerName, OffsetDateTime now, OffsetDateTime lockExpiredBefore) {
        return jobRepository.lockUnowned(jobId, workerName, now, lockExpiredBefore);
    }

    @Override
    public int relockOwned(UUID jobId, String workerName, OffsetDateTime now) {
        return jobRepository.relockOwned(jobId, workerName, now);
    }

    @Override
    public int clearLocks(String workerName) {
        return jobRepository.clearLocks(workerName);
    }
}
