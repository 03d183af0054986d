package com.leaguebot.api.controller;

import com.leaguebot.api.dto.BatchProcessingResult;
import com.leaguebot.api.exception.ResourceNotFoundException;
import com.leaguebot.api.repository.GuildRepository;
import com.leaguebot.api.service.TrackerBatchProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/internal/trackers/process")
public class TrackerProcessingController {
    private static final Logger log = LoggerFactory.getLogger(TrackerProcessingController.class);

    private final TrackerBatchProcessor batchProcessor;
    private final GuildRepository guildRepository;

    public TrackerProcessingController(TrackerBatchProcessor batchProcessor, GuildRepository guildRepository) {
        this.batchProcessor = batchProcessor;
        this.guildRepository = guildRepository;
    }

    @PostMapping
    public BatchProcessingResult processAll() {
        BatchProcessingResult result = batchProcessor.processAllPending();
        log.info("[TrackerProcessing][All] processed={}", result.getProcessedCount());
        return result;
    }

    @PostMapping("/guild/{guildId}")
    public BatchProcessingResult processGuild(@PathVariable String guildId) {
        if (!guildRepository.existsById(guildId)) {
            throw new ResourceNotFoundException("Guild " + guildId + " not found");
        }
        BatchProcessingResult result = batchProcessor.processPendingForGuild(guildId);
        log.info("[TrackerProcessing][Guild] guildId={} processed={}", guildId, result.getProcessedCount());
        return result;
    }
}
