package com.leaguebot.api.dto;

import com.leaguebot.api.model.ScheduledTrackerProcessing;

import java.time.Instant;
import java.util.Map;

public class ScheduledProcessingDTO {
    private String id;
    private String guildId;
    private Instant scheduledAt;
    private String status;
    private String createdBy;
    private Instant executedAt;
    private String errorMessage;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;

    public ScheduledProcessingDTO() {}

    public static ScheduledProcessingDTO from(ScheduledTrackerProcessing s) {
        ScheduledProcessingDTO dto = new ScheduledProcessingDTO();
        dto.id = s.getId();
        dto.guildId = s.getGuildId();
        dto.scheduledAt = s.getScheduledAt();
        dto.status = s.getStatus() != null ? s.getStatus().name() : null;
        dto.createdBy = s.getCreatedBy();
        dto.executedAt = s.getExecutedAt();
        dto.errorMessage = s.getErrorMessage();
        dto.metadata = s.getMetadata();
        dto.createdAt = s.getCreatedAt();
        dto.updatedAt = s.getUpdatedAt();
        return dto;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getGuildId() { return guildId; }
    public void setGuildId(String guildId) { this.guildId = guildId; }
    public Instant getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(Instant scheduledAt) { this.scheduledAt = scheduledAt; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(Instant executedAt) { this.executedAt = executedAt; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
