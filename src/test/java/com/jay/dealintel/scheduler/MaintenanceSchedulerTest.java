package com.jay.dealintel.scheduler;

import com.jay.dealintel.cache.ScoreReportCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

    @Mock
    private ScoreReportCache scoreReportCache;

    @InjectMocks
    private MaintenanceScheduler scheduler;

    @Test
    void evictsExpiredReports() {
        when(scoreReportCache.evictExpired()).thenReturn(3);
        when(scoreReportCache.size()).thenReturn(7);

        scheduler.evictExpiredReports();

        verify(scoreReportCache).evictExpired();
        verify(scoreReportCache).size();
    }

    @Test
    void evictionFailureDoesNotEscapeTheJob() {
        when(scoreReportCache.evictExpired()).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> scheduler.evictExpiredReports()).doesNotThrowAnyException();
    }
}
