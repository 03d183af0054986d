package com.leaguebot.api.service;

import com.leaguebot.api.repository.TrackerProcessingLeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

// a tracker with an unexpired row in tracker_processing_leases is skipped
@Service
@Transactional(readOnly = true)
public class LeaseTrackerProcessingGuard implements TrackerProcessingGuard {
    private static final Logger log = LoggerFactory.getLogger(LeaseTrackerProcessingGuard.class);

    private final TrackerProcessingLeaseRepository leaseRepository;

    public LeaseTrackerProcessingGuard(TrackerProcessingLeaseRepository leaseRepository) {
        this.leaseRepository = leaseRepository;
    }

    @Override
    public List<String> filterProcessable(List<String> trackerIds) {
        if (trackerIds.isEmpty()) return List.of();
        Set<String> leased = new HashSet<>(leaseRepository.findLeasedTrackerIds(trackerIds, Instant.now()));
        if (leased.isEmpty()) return List.copyOf(trackerIds);
        log.debug("[ProcessingGuard] skipping {} leased tracker(s): {}", leased.size(), leased);
        return trackerIds.stream()
                .filter(id -> !leased.contains(id))
                .collect(Collectors.toList());
    }
}
