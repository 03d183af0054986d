package com.leaguebot.api.model;

import jakarta.persistence.*;

@Entity
@Table(name = "guild_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_guild_member", columnNames = {"guild_id", "user_id"}),
        indexes = @Index(name = "idx_guild_members_user", columnList = "user_id"))
public class GuildMember {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guild_id", length = 32, nullable = false)
    private String guildId;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "is_banned", nullable = false)
    private boolean banned = false;

    public GuildMember() {}

    public GuildMember(String guildId, String userId) {
        this.guildId = guildId;
        this.userId = userId;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getGuildId() { return guildId; }
    public void setGuildId(String guildId) { this.guildId = guildId; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public boolean isBanned() { return banned; }
    public void setBanned(boolean banned) { this.banned = banned; }
}
