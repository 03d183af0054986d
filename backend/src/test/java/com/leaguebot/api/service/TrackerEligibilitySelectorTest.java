package com.leaguebot.api.service;

import com.leaguebot.api.model.Guild;
import com.leaguebot.api.model.GuildMember;
import com.leaguebot.api.model.Tracker;
import com.leaguebot.api.model.TrackerScrapingStatus;
import com.leaguebot.api.repository.GuildMemberRepository;
import com.leaguebot.api.repository.GuildRepository;
import com.leaguebot.api.repository.TrackerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import(TrackerEligibilitySelector.class)
class TrackerEligibilitySelectorTest {

    @Autowired private TrackerRepository trackerRepository;
    @Autowired private GuildRepository guildRepository;
    @Autowired private GuildMemberRepository guildMemberRepository;
    @Autowired private TrackerEligibilitySelector selector;

    private Instant now;
    private int seq;

    @BeforeEach
    void setup() {
        now = Instant.now();
        seq = 0;
        guildRepository.save(new Guild("g1", "Guild One"));
        guildRepository.save(new Guild("g2", "Guild Two"));
        guildMemberRepository.save(new GuildMember("g1", "alice"));
        guildMemberRepository.save(new GuildMember("g1", "bob"));
        guildMemberRepository.save(new GuildMember("g2", "carol"));
        GuildMember banned = new GuildMember("g1", "mallory");
        banned.setBanned(true);
        guildMemberRepository.save(banned);
    }

    private Tracker tracker(String userId, TrackerScrapingStatus status, Instant lastScrapedAt) {
        Tracker t = new Tracker(userId, "https://tracker.example/" + userId + "/" + seq);
        t.setScrapingStatus(status);
        t.setLastScrapedAt(lastScrapedAt);
        // spaced creation times keep the expected order deterministic
        t.setCreatedAt(now.minus(60 - seq++, ChronoUnit.MINUTES));
        return trackerRepository.save(t);
    }

    @Test
    void selectsPendingNeverScrapedAndStaleButNotInProgress() {
        Tracker pending = tracker("alice", TrackerScrapingStatus.PENDING, now.minus(1, ChronoUnit.HOURS));
        Tracker neverScraped = tracker("alice", TrackerScrapingStatus.COMPLETED, null);
        Tracker stale = tracker("bob", TrackerScrapingStatus.COMPLETED, now.minus(25, ChronoUnit.HOURS));
        tracker("bob", TrackerScrapingStatus.IN_PROGRESS, null);
        tracker("bob", TrackerScrapingStatus.COMPLETED, now.minus(2, ChronoUnit.HOURS));

        assertThat(selector.selectForGuild("g1", 24))
                .containsExactly(pending.getId(), neverScraped.getId(), stale.getId());
    }

    @Test
    void excludesOtherGuildsBannedMembersAndRemovedTrackers() {
        Tracker mine = tracker("alice", TrackerScrapingStatus.PENDING, null);
        Tracker otherGuild = tracker("carol", TrackerScrapingStatus.PENDING, null);
        tracker("mallory", TrackerScrapingStatus.PENDING, null);
        Tracker deleted = tracker("alice", TrackerScrapingStatus.PENDING, null);
        deleted.setDeleted(true);
        trackerRepository.save(deleted);
        Tracker inactive = tracker("bob", TrackerScrapingStatus.PENDING, null);
        inactive.setActive(false);
        trackerRepository.save(inactive);

        assertThat(selector.selectForGuild("g1", 24)).containsExactly(mine.getId());
        assertThat(selector.selectForGuild("g2", 24)).containsExactly(otherGuild.getId());
    }

    @Test
    void selectAllIgnoresGuildMembership() {
        Tracker a = tracker("alice", TrackerScrapingStatus.COMPLETED, now.minus(30, ChronoUnit.HOURS));
        Tracker orphan = tracker("nobody", TrackerScrapingStatus.PENDING, null);
        tracker("carol", TrackerScrapingStatus.IN_PROGRESS, now.minus(30, ChronoUnit.HOURS));

        assertThat(selector.selectAll(24)).containsExactly(a.getId(), orphan.getId());
    }

    @Test
    void intervalControlsStaleness() {
        Tracker sixHoursOld = tracker("alice", TrackerScrapingStatus.COMPLETED, now.minus(6, ChronoUnit.HOURS));

        assertThat(selector.selectForGuild("g1", 24)).isEmpty();
        assertThat(selector.selectForGuild("g1", 4)).containsExactly(sixHoursOld.getId());
    }

    @Test
    void emptyGuildYieldsEmptyList() {
        assertThat(selector.selectForGuild("g-empty", 24)).isEmpty();
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        assertThatThrownBy(() -> selector.selectForGuild("g1", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.selectAll(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
