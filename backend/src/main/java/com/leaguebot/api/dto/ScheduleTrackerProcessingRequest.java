package com.leaguebot.api.dto;

import java.time.Instant;
import java.util.Map;

public class ScheduleTrackerProcessingRequest {
    private String guildId;
    private Instant scheduledAt;
    private String createdBy;
    private Map<String, Object> metadata; // optional, e.g. reason or season info

    public String getGuildId() { return guildId; }
    public void setGuildId(String guildId) { this.guildId = guildId; }
    public Instant getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(Instant scheduledAt) { this.scheduledAt = scheduledAt; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
}
