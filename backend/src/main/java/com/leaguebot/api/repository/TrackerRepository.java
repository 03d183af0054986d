package com.leaguebot.api.repository;

import com.leaguebot.api.model.Tracker;
import com.leaguebot.api.model.TrackerScrapingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface TrackerRepository extends JpaRepository<Tracker, String> {

    // Pending OR never scraped OR scraped before cutoff; kept as one flat OR group, nesting it changed the results.
    // In-progress trackers are excluded so a running batch is not resubmitted.
    @Query("select t.id from Tracker t " +
            "where t.active = true and t.deleted = false " +
            "and t.scrapingStatus <> :inProgress " +
            "and t.userId in (select m.userId from GuildMember m where m.guildId = :guildId and m.deleted = false and m.banned = false) " +
            "and (t.scrapingStatus = :pending or t.lastScrapedAt is null or t.lastScrapedAt < :cutoff) " +
            "order by t.createdAt asc, t.id asc")
    List<String> findPendingAndStaleIdsForGuild(@Param("guildId") String guildId,
                                                @Param("cutoff") Instant cutoff,
                                                @Param("pending") TrackerScrapingStatus pending,
                                                @Param("inProgress") TrackerScrapingStatus inProgress);

    @Query("select t.id from Tracker t " +
            "where t.active = true and t.deleted = false " +
            "and t.scrapingStatus <> :inProgress " +
            "and (t.scrapingStatus = :pending or t.lastScrapedAt is null or t.lastScrapedAt < :cutoff) " +
            "order by t.createdAt asc, t.id asc")
    List<String> findPendingAndStaleIds(@Param("cutoff") Instant cutoff,
                                        @Param("pending") TrackerScrapingStatus pending,
                                        @Param("inProgress") TrackerScrapingStatus inProgress);

    default List<String> findPendingAndStaleIdsForGuild(String guildId, Instant cutoff) {
        return findPendingAndStaleIdsForGuild(guildId, cutoff, TrackerScrapingStatus.PENDING, TrackerScrapingStatus.IN_PROGRESS);
    }

    default List<String> findPendingAndStaleIds(Instant cutoff) {
        return findPendingAndStaleIds(cutoff, TrackerScrapingStatus.PENDING, TrackerScrapingStatus.IN_PROGRESS);
    }

    List<Tracker> findByIdIn(Collection<String> ids);
}
