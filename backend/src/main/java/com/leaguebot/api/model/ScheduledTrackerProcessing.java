package com.leaguebot.api.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "scheduled_tracker_processing", indexes = {
        @Index(name = "idx_stp_guild_scheduled", columnList = "guild_id, scheduled_at"),
        @Index(name = "idx_stp_status", columnList = "status")
})
public class ScheduledTrackerProcessing {
    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "guild_id", length = 32, nullable = false)
    private String guildId;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false, columnDefinition = "varchar(16)")
    private ScheduledProcessingStatus status = ScheduledProcessingStatus.PENDING;

    @Column(name = "created_by", length = 64, nullable = false)
    private String createdBy;

    @Column(name = "executed_at")
    private Instant executedAt;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(columnDefinition = "text")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ScheduledTrackerProcessing() {}

    public ScheduledTrackerProcessing(String guildId, Instant scheduledAt, String createdBy, Map<String, Object> metadata) {
        this.guildId = guildId;
        this.scheduledAt = scheduledAt;
        this.createdBy = createdBy;
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    @PrePersist
    public void prePersist() {
        if (id == null) id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getGuildId() { return guildId; }
    public void setGuildId(String guildId) { this.guildId = guildId; }
    public Instant getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(Instant scheduledAt) { this.scheduledAt = scheduledAt; }
    public ScheduledProcessingStatus getStatus() { return status; }
    public void setStatus(ScheduledProcessingStatus status) { this.status = status; }
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
