package com.delayq.internal;

import com.delayq.JobRepository;
import com.delayq.config.DelayQProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JobCleanerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-02T09:30:00Z");

    private JobRepository jobRepository;
    private DelayQProperties properties;
    private JobCleaner cleaner;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        properties = new DelayQProperties();
        cleaner = new JobCleaner(jobRepository, properties, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    void shouldKeepFailedJobsWhenRetentionIsUnset() {
        cleaner.cleanup();

        verifyNoInteractions(jobRepository);
    }

    @Test
    void shouldDeleteFailedJobsOlderThanRetention() {
        properties.getWorker().setDeleteFailedJobsAfter("7d");
        when(jobRepository.deleteByFailedAtBefore(any())).thenReturn(4);

        cleaner.cleanup();

        verify(jobRepository).deleteByFailedAtBefore(NOW.minusDays(7));
    }

    @Test
    void shouldNotPropagateDatabaseErrors() {
        properties.getWorker().setDeleteFailedJobsAfter("PT12H");
        when(jobRepository.deleteByFailedAtBefore(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertDoesNotThrow(cleaner::cleanup);
    }

    @Test
    void shouldParseIsoAndShorthandDurations() {
        assertThat(JobCleaner.parseDuration("PT36H")).isEqualTo(Duration.ofHours(36));
        assertThat(JobCleaner.parseDuration("36h")).isEqualTo(Duration.ofHours(36));
        assertThat(JobCleaner.parseDuration(" 7D ")).isEqualTo(Duration.ofDays(7));
        assertThatThrownBy(() -> JobCleaner.parseDuration("soon")).isInstanceOf(IllegalArgumentException.class);
    }
}
