package com.leaguebot.api.service;

import com.leaguebot.api.model.Guild;
import com.leaguebot.api.model.GuildMember;
import com.leaguebot.api.model.Tracker;
import com.leaguebot.api.repository.GuildMemberRepository;
import com.leaguebot.api.repository.GuildRepository;
import com.leaguebot.api.repository.TrackerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies the per-guild "tracker processing" setting to automatic runs. A tracker stays eligible
 * when its owner has no active guild membership, or when at least one of the owner's guilds has
 * processing enabled.
 */
@Service
@Transactional(readOnly = true)
public class GuildProcessingToggleFilter {

    private final TrackerRepository trackerRepository;
    private final GuildMemberRepository guildMemberRepository;
    private final GuildRepository guildRepository;

    public GuildProcessingToggleFilter(TrackerRepository trackerRepository,
                                       GuildMemberRepository guildMemberRepository,
                                       GuildRepository guildRepository) {
        this.trackerRepository = trackerRepository;
        this.guildMemberRepository = guildMemberRepository;
        this.guildRepository = guildRepository;
    }

    public List<String> filterEnabled(List<String> trackerIds) {
        if (trackerIds.isEmpty()) return List.of();

        Map<String, String> ownerByTracker = trackerRepository.findByIdIn(trackerIds).stream()
                .collect(Collectors.toMap(Tracker::getId, Tracker::getUserId));
        Set<String> owners = new HashSet<>(ownerByTracker.values());

        Map<String, List<String>> guildsByUser = guildMemberRepository.findByUserIdInAndDeletedFalseAndBannedFalse(owners).stream()
                .collect(Collectors.groupingBy(GuildMember::getUserId,
                        Collectors.mapping(GuildMember::getGuildId, Collectors.toList())));
        Set<String> guildIds = guildsByUser.values().stream().flatMap(List::stream).collect(Collectors.toSet());
        Map<String, Boolean> enabledByGuild = guildRepository.findAllById(guildIds).stream()
                .collect(Collectors.toMap(Guild::getId, Guild::isTrackerProcessingEnabled));

        Map<String, Boolean> userCache = new HashMap<>();
        return trackerIds.stream()
                .filter(id -> {
                    String owner = ownerByTracker.get(id);
                    if (owner == null) return false;
                    return userCache.computeIfAbsent(owner, u -> {
                        List<String> guilds = guildsByUser.get(u);
                        if (guilds == null || guilds.isEmpty()) return true;
                        // a guild row we cannot see counts as enabled
                        return guilds.stream().anyMatch(g -> enabledByGuild.getOrDefault(g, true));
                    });
                })
                .collect(Collectors.toList());
    }
}
