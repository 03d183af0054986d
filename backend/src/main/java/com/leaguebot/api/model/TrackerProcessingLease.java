package com.leaguebot.api.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "tracker_processing_leases", indexes = {
        @Index(name = "idx_tracker_leases_expires", columnList = "expires_at")
})
public class TrackerProcessingLease {
    @Id
    @Column(name = "tracker_id", length = 36)
    private String trackerId;

    @Column(name = "locked_by", length = 128)
    private String lockedBy;

    @Column(name = "locked_at", nullable = false)
    private Instant lockedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public TrackerProcessingLease() {}

    public TrackerProcessingLease(String trackerId, String lockedBy, Instant lockedAt, Instant expiresAt) {
        this.trackerId = trackerId;
        this.lockedBy = lockedBy;
        this.lockedAt = lockedAt;
        this.expiresAt = expiresAt;
    }

    public String getTrackerId() { return trackerId; }
    public void setTrackerId(String trackerId) { this.trackerId = trackerId; }
    public String getLockedBy() { return lockedBy; }
    public void setLockedBy(String lockedBy) { this.lockedBy = lockedBy; }
    public Instant getLockedAt() { return lockedAt; }
    public void setLockedAt(Instant lockedAt) { this.lockedAt = lockedAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
