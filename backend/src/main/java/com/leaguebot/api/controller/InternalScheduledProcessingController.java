package com.leaguebot.api.controller;

import com.leaguebot.api.dto.ScheduleTrackerProcessingRequest;
import com.leaguebot.api.dto.ScheduledProcessingDTO;
import com.leaguebot.api.model.ScheduledProcessingStatus;
import com.leaguebot.api.service.ScheduledTrackerProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/internal/trackers/schedule")
public class InternalScheduledProcessingController {
    private static final Logger log = LoggerFactory.getLogger(InternalScheduledProcessingController.class);

    private final ScheduledTrackerProcessingService scheduledProcessingService;

    public InternalScheduledProcessingController(ScheduledTrackerProcessingService scheduledProcessingService) {
        this.scheduledProcessingService = scheduledProcessingService;
    }

    @PostMapping
    public ResponseEntity<ScheduledProcessingDTO> schedule(@RequestBody ScheduleTrackerProcessingRequest body) {
        log.info("[InternalScheduledProcessing][Schedule] guildId={} scheduledAt={} createdBy={}",
                body.getGuildId(), body.getScheduledAt(), body.getCreatedBy());
        var created = scheduledProcessingService.createSchedule(
                body.getGuildId(), body.getScheduledAt(), body.getCreatedBy(), body.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduledProcessingDTO.from(created));
    }

    @GetMapping("/guild/{guildId}")
    public List<ScheduledProcessingDTO> forGuild(@PathVariable String guildId,
                                                 @RequestParam(value = "status", required = false) String status,
                                                 @RequestParam(value = "includeCompleted", required = false) Boolean includeCompleted) {
        return scheduledProcessingService.getSchedulesForGuild(guildId, parseStatus(status), includeCompleted).stream()
                .map(ScheduledProcessingDTO::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ScheduledProcessingDTO get(@PathVariable String id) {
        return ScheduledProcessingDTO.from(scheduledProcessingService.getSchedule(id));
    }

    @PostMapping("/{id}/cancel")
    public ScheduledProcessingDTO cancel(@PathVariable String id) {
        return ScheduledProcessingDTO.from(scheduledProcessingService.cancelSchedule(id));
    }

    private static ScheduledProcessingStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return ScheduledProcessingStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid status: " + status);
        }
    }
}
