package com.leaguebot.api.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local FIFO of tracker ids waiting for the scraping worker. An id that is already
 * waiting keeps its original position when submitted again.
 */
@Component
public class InMemoryTrackerScrapingQueue implements TrackerScrapingQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTrackerScrapingQueue.class);

    private final Map<String, Instant> queued = new LinkedHashMap<>();
    private final Duration retention;

    public InMemoryTrackerScrapingQueue(@Value("${tracker.queue.retention-hours:24}") long retentionHours) {
        this.retention = Duration.ofHours(retentionHours);
    }

    @Override
    public synchronized void submitBatch(List<String> trackerIds) {
        Instant now = Instant.now();
        int added = 0;
        for (String id : trackerIds) {
            if (queued.putIfAbsent(id, now) == null) added++;
        }
        log.info("[ScrapingQueue][Submit] submitted={} added={} duplicates={} depth={}",
                trackerIds.size(), added, trackerIds.size() - added, queued.size());
    }

    /**
     * Removes and returns up to {@code max} ids in submission order.
     */
    public synchronized List<String> drain(int max) {
        List<String> out = new ArrayList<>(Math.min(max, queued.size()));
        Iterator<String> it = queued.keySet().iterator();
        while (it.hasNext() && out.size() < max) {
            out.add(it.next());
            it.remove();
        }
        return out;
    }

    public synchronized int size() {
        return queued.size();
    }

    synchronized boolean contains(String trackerId) {
        return queued.containsKey(trackerId);
    }

    @Scheduled(cron = "0 0 * * * *") // hourly cleanup
    public synchronized void purgeExpired() {
        purgeOlderThan(Instant.now().minus(retention));
    }

    synchronized int purgeOlderThan(Instant cutoff) {
        int before = queued.size();
        queued.values().removeIf(at -> at.isBefore(cutoff));
        int removed = before - queued.size();
        if (removed > 0) {
            log.warn("[ScrapingQueue][Purge] removed={} entries queued before {}", removed, cutoff);
        }
        return removed;
    }
}
