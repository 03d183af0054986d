package com.leaguebot.api.service;

import com.leaguebot.api.dto.BatchProcessingResult;
import com.leaguebot.api.queue.TrackerScrapingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TrackerBatchProcessor {
    private static final Logger log = LoggerFactory.getLogger(TrackerBatchProcessor.class);

    private final TrackerEligibilitySelector selector;
    private final TrackerProcessingGuard processingGuard;
    private final GuildProcessingToggleFilter toggleFilter;
    private final TrackerScrapingQueue scrapingQueue;
    private final int refreshIntervalHours;

    public TrackerBatchProcessor(TrackerEligibilitySelector selector,
                                 TrackerProcessingGuard processingGuard,
                                 GuildProcessingToggleFilter toggleFilter,
                                 TrackerScrapingQueue scrapingQueue,
                                 @Value("${tracker.refresh-interval-hours:#{null}}") Integer refreshIntervalHours) {
        if (refreshIntervalHours == null) {
            throw new IllegalStateException("Tracker configuration is missing: tracker.refresh-interval-hours must be set");
        }
        if (refreshIntervalHours <= 0) {
            throw new IllegalStateException("Tracker configuration is invalid: tracker.refresh-interval-hours=" + refreshIntervalHours);
        }
        this.selector = selector;
        this.processingGuard = processingGuard;
        this.toggleFilter = toggleFilter;
        this.scrapingQueue = scrapingQueue;
        this.refreshIntervalHours = refreshIntervalHours;
        log.info("[TrackerBatch] refreshIntervalHours={}", refreshIntervalHours);
    }

    /**
     * Periodic sweep across every guild, started by {@code TrackerRefreshScheduler} or on demand.
     * Honours each guild's tracker processing setting.
     */
    public BatchProcessingResult processAllPending() {
        List<String> candidates = selector.selectAll(refreshIntervalHours);
        if (candidates.isEmpty()) {
            log.info("[TrackerBatch][All] No pending or stale trackers to process");
            return BatchProcessingResult.empty();
        }
        List<String> processable = toggleFilter.filterEnabled(processingGuard.filterProcessable(candidates));
        if (processable.isEmpty()) {
            log.info("[TrackerBatch][All] Found {} candidate trackers, none processable (leased or disabled by guild settings)",
                    candidates.size());
            return BatchProcessingResult.empty();
        }
        scrapingQueue.submitBatch(processable);
        log.info("[TrackerBatch][All] Enqueued {} trackers ({} skipped)", processable.size(), candidates.size() - processable.size());
        return BatchProcessingResult.of(processable);
    }

    /**
     * Refresh for one guild, used by on-demand guild refresh and by scheduled refreshes.
     * The guild processing setting is not consulted: this path is always an operator action.
     */
    public BatchProcessingResult processPendingForGuild(String guildId) {
        List<String> candidates = selector.selectForGuild(guildId, refreshIntervalHours);
        if (candidates.isEmpty()) {
            log.info("[TrackerBatch][Guild] No pending or stale trackers to process for guild {}", guildId);
            return BatchProcessingResult.empty();
        }
        List<String> processable = processingGuard.filterProcessable(candidates);
        if (processable.isEmpty()) {
            log.info("[TrackerBatch][Guild] guildId={} all {} candidate trackers are already being processed", guildId, candidates.size());
            return BatchProcessingResult.empty();
        }
        scrapingQueue.submitBatch(processable);
        log.info("[TrackerBatch][Guild] guildId={} enqueued={} skipped={}", guildId, processable.size(), candidates.size() - processable.size());
        return BatchProcessingResult.of(processable);
    }
}
