package com.leaguebot.api.config;

import com.leaguebot.api.dto.BatchProcessingResult;
import com.leaguebot.api.service.TrackerBatchProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class TrackerRefreshScheduler {
    private static final Logger log = LoggerFactory.getLogger(TrackerRefreshScheduler.class);

    private final TrackerBatchProcessor batchProcessor;

    public TrackerRefreshScheduler(TrackerBatchProcessor batchProcessor) {
        this.batchProcessor = batchProcessor;
    }

    // Nightly by default, enqueue every stale tracker in guilds that have processing enabled
    @Scheduled(cron = "${tracker.refresh-cron:0 0 2 * * *}")
    public void refreshStaleTrackers() {
        try {
            BatchProcessingResult result = batchProcessor.processAllPending();
            if (result.getProcessedCount() > 0) {
                log.info("[TrackerRefresh] Background refresh enqueued {} trackers.", result.getProcessedCount());
            }
        } catch (Exception e) {
            log.warn("[TrackerRefresh] Background tracker refresh failed: {}", e.getMessage());
        }
    }
}
