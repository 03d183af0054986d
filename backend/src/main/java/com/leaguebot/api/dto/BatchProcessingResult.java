package com.leaguebot.api.dto;

import java.util.List;

public class BatchProcessingResult {
    private int processedCount;
    private List<String> trackerIds;

    public BatchProcessingResult() {}

    public BatchProcessingResult(int processedCount, List<String> trackerIds) {
        this.processedCount = processedCount;
        this.trackerIds = trackerIds;
    }

    public static BatchProcessingResult empty() {
        return new BatchProcessingResult(0, List.of());
    }

    public static BatchProcessingResult of(List<String> trackerIds) {
        return new BatchProcessingResult(trackerIds.size(), List.copyOf(trackerIds));
    }

    public int getProcessedCount() { return processedCount; }
    public void setProcessedCount(int processedCount) { this.processedCount = processedCount; }
    public List<String> getTrackerIds() { return trackerIds; }
    public void setTrackerIds(List<String> trackerIds) { this.trackerIds = trackerIds; }
}
