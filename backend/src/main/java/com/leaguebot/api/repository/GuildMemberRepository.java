package com.leaguebot.api.repository;

import com.leaguebot.api.model.GuildMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface GuildMemberRepository extends JpaRepository<GuildMember, Long> {
    List<GuildMember> findByUserIdInAndDeletedFalseAndBannedFalse(Collection<String> userIds);
}
