package com.leaguebot.api.repository;

import com.leaguebot.api.model.Guild;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GuildRepository extends JpaRepository<Guild, String> {
}
