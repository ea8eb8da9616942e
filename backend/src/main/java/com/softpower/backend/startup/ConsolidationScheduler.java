package com.softpower.backend.startup;

import com.softpower.backend.events.dto.ConsolidationReport;
import com.softpower.backend.events.service.CanonicalEventMergeService;
import com.softpower.backend.events.service.ConsolidationScope;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic consolidation of the configured countries. Disabled unless {@code consolidation.cron} is set;
 * reruns are safe because a consolidated country has nothing left to fold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsolidationScheduler {

    private final CanonicalEventMergeService mergeService;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${consolidation.cron:-}")
    public void scheduledConsolidation() {
        if (!running.compareAndSet(false, true)) {
            log.info("⏳ Skipping scheduled consolidation - previous run still in progress");
            return;
        }

        log.info("⏰ SCHEDULED CONSOLIDATION STARTED");
        try {
            ConsolidationReport report = mergeService.consolidate(ConsolidationScope.configured(), false);
            if (report.isSuccessful()) {
                log.info("✅ Scheduled consolidation completed: {} child events merged",
                        report.getTotals().getEventsDeleted());
            } else {
                log.warn("⚠️ Scheduled consolidation finished with failed countries: {}", report.getFailedCountries());
            }
        } catch (Exception e) {
            log.error("❌ Scheduled consolidation failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
