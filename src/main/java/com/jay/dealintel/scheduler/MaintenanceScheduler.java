package com.jay.dealintel.scheduler;

import com.jay.dealintel.cache.ScoreReportCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Housekeeping jobs. Currently evicts expired deal score reports every five minutes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final ScoreReportCache scoreReportCache;

    @Scheduled(fixedDelayString = "${deal-intel.cache.eviction-interval-ms:300000}")
    public void evictExpiredReports() {
        try {
            int evicted = scoreReportCache.evictExpired();
            if (evicted > 0) {
                log.info("Evicted {} expired score reports, {} remain", evicted, scoreReportCache.size());
            }
        } catch (Exception e) {
            log.error("Score report eviction failed: {}", e.getMessage(), e);
        }
    }
}
