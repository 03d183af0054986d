package com.leaguebot.api.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "trackers", indexes = {
        @Index(name = "idx_trackers_user", columnList = "user_id"),
        @Index(name = "idx_trackers_status", columnList = "scraping_status")
})
public class Tracker {
    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(length = 500)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(name = "scraping_status", length = 16, nullable = false, columnDefinition = "varchar(16)")
    private TrackerScrapingStatus scrapingStatus = TrackerScrapingStatus.PENDING;

    @Column(name = "last_scraped_at")
    private Instant lastScrapedAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Tracker() {}

    public Tracker(String userId, String url) {
        this.userId = userId;
        this.url = url;
    }

    @PrePersist
    public void prePersist() {
        if (id == null) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = Instant.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public TrackerScrapingStatus getScrapingStatus() { return scrapingStatus; }
    public void setScrapingStatus(TrackerScrapingStatus scrapingStatus) { this.scrapingStatus = scrapingStatus; }
    public Instant getLastScrapedAt() { return lastScrapedAt; }
    public void setLastScrapedAt(Instant lastScrapedAt) { this.lastScrapedAt = lastScrapedAt; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
