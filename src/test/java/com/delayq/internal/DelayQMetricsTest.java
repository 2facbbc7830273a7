package com.delayq.internal;

import com.delayq.JobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DelayQMetricsTest {

    private JobRepository jobRepository;
    private MeterRegistry meterRegistry;
    private DelayQMetrics delayQMetrics;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:30:00Z"), ZoneOffset.UTC);
        delayQMetrics = new DelayQMetrics(jobRepository, meterRegistry, clock);
    }

    @Test
    void shouldRegisterGaugesForQueueStates() {
        JobRepository.QueueCounts counts = mock(JobRepository.QueueCounts.class);
        when(counts.getReadyCount()).thenReturn(10L);
        when(counts.getLockedCount()).thenReturn(3L);
        when(counts.getFailedCount()).thenReturn(2L);
        when(jobRepository.countQueueStates(any(OffsetDateTime.class))).thenReturn(counts);

        delayQMetrics.registerMetrics();

        Gauge readyGauge = meterRegistry.find("delayq.jobs.count").tag("state", "READY").gauge();
        assertThat(readyGauge).isNotNull();
        assertThat(readyGauge.value()).isEqualTo(10.0);

        Gauge lockedGauge = meterRegistry.find("delayq.jobs.count").tag("state", "LOCKED").gauge();
        assertThat(lockedGauge).isNotNull();
        assertThat(lockedGauge.value()).isEqualTo(3.0);

        Gauge totalGauge = meterRegistry.find("delayq.jobs.total").gauge();
        assertThat(totalGauge).isNotNull();
        assertThat(totalGauge.value()).isEqualTo(15.0);

        verify(jobRepository, times(1)).countQueueStates(OffsetDateTime.parse("2026-03-02T09:30:00Z"));
    }

    @Test
    void shouldReportZeroWhenCountsCannotBeLoaded() {
        when(jobRepository.countQueueStates(any(OffsetDateTime.class)))
                .thenThrow(new IllegalStateException("database unavailable"));

        delayQMetrics.registerMetrics();

        Gauge failedGauge = meterRegistry.find("delayq.jobs.count").tag("state", "FAILED").gauge();
        assertThat(failedGauge).isNotNull();
        assertThat(failedGauge.value()).isZero();
    }
}
