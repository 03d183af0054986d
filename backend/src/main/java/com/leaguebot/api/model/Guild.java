package com.leaguebot.api.model;

import jakarta.persistence.*;

@Entity
@Table(name = "guilds")
public class Guild {
    @Id
    @Column(length = 32)
    private String id;

    @Column(length = 200, nullable = false)
    private String name;

    // guild setting: automatic (all-guild) tracker processing on/off
    @Column(name = "tracker_processing_enabled", nullable = false)
    private boolean trackerProcessingEnabled = true;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public Guild() {}

    public Guild(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public boolean isTrackerProcessingEnabled() { return trackerProcessingEnabled; }
    public void setTrackerProcessingEnabled(boolean trackerProcessingEnabled) { this.trackerProcessingEnabled = trackerProcessingEnabled; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
