package com.leaguebot.api.service;

import com.leaguebot.api.repository.TrackerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Picks the trackers that need a refresh: never scraped, still pending their first scrape,
 * or last scraped before {@code now - refreshIntervalHours}. Trackers currently being scraped
 * are never returned. Only ids leave this class.
 */
@Service
@Transactional(readOnly = true)
public class TrackerEligibilitySelector {
    private static final Logger log = LoggerFactory.getLogger(TrackerEligibilitySelector.class);

    private final TrackerRepository trackerRepository;

    public TrackerEligibilitySelector(TrackerRepository trackerRepository) {
        this.trackerRepository = trackerRepository;
    }

    public List<String> selectForGuild(String guildId, int refreshIntervalHours) {
        Instant cutoff = cutoff(refreshIntervalHours);
        List<String> ids = trackerRepository.findPendingAndStaleIdsForGuild(guildId, cutoff);
        log.debug("[Eligibility][Guild] guildId={} cutoff={} selected={}", guildId, cutoff, ids.size());
        return ids;
    }

    public List<String> selectAll(int refreshIntervalHours) {
        Instant cutoff = cutoff(refreshIntervalHours);
        List<String> ids = trackerRepository.findPendingAndStaleIds(cutoff);
        log.debug("[Eligibility][All] cutoff={} selected={}", cutoff, ids.size());
        return ids;
    }

    private static Instant cutoff(int refreshIntervalHours) {
        if (refreshIntervalHours <= 0) {
            throw new IllegalArgumentException("refreshIntervalHours must be positive: " + refreshIntervalHours);
        }
        return Instant.now().minus(Duration.ofHours(refreshIntervalHours));
    }
}
