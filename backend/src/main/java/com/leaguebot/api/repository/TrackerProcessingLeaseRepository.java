package com.leaguebot.api.repository;

import com.leaguebot.api.model.TrackerProcessingLease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface TrackerProcessingLeaseRepository extends JpaRepository<TrackerProcessingLease, String> {
    @Query("select l.trackerId from TrackerProcessingLease l where l.trackerId in :ids and l.expiresAt > :now")
    List<String> findLeasedTrackerIds(@Param("ids") Collection<String> ids, @Param("now") Instant now);
}
