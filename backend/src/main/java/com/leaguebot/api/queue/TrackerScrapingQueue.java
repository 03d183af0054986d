package com.leaguebot.api.queue;

import java.util.List;

public interface TrackerScrapingQueue {
    void submitBatch(List<String> trackerIds);
}
