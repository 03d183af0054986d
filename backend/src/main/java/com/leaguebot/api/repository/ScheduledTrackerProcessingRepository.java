package com.leaguebot.api.repository;

import com.leaguebot.api.model.ScheduledProcessingStatus;
import com.leaguebot.api.model.ScheduledTrackerProcessing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface ScheduledTrackerProcessingRepository extends JpaRepository<ScheduledTrackerProcessing, String> {

    List<ScheduledTrackerProcessing> findByGuildIdOrderByScheduledAtAsc(String guildId);

    List<ScheduledTrackerProcessing> findByGuildIdAndStatusOrderByScheduledAtAsc(String guildId, ScheduledProcessingStatus status);

    List<ScheduledTrackerProcessing> findByGuildIdAndStatusNotOrderByScheduledAtAsc(String guildId, ScheduledProcessingStatus status);

    List<ScheduledTrackerProcessing> findByStatusOrderByScheduledAtAsc(ScheduledProcessingStatus status);

    default List<ScheduledTrackerProcessing> findPending() {
        return findByStatusOrderByScheduledAtAsc(ScheduledProcessingStatus.PENDING);
    }

    /**
     * Moves a row out of {@code expected} in one statement. Returns 0 when the row is missing
     * or already left {@code expected}, so a terminal status is never overwritten.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update ScheduledTrackerProcessing s set s.status = :status, s.executedAt = :executedAt, " +
            "s.errorMessage = :errorMessage, s.updatedAt = :updatedAt " +
            "where s.id = :id and s.status = :expected")
    int transition(@Param("id") String id,
                   @Param("expected") ScheduledProcessingStatus expected,
                   @Param("status") ScheduledProcessingStatus status,
                   @Param("executedAt") Instant executedAt,
                   @Param("errorMessage") String errorMessage,
                   @Param("updatedAt") Instant updatedAt);

    default int markTerminal(String id, ScheduledProcessingStatus status, Instant executedAt, String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        return transition(id, ScheduledProcessingStatus.PENDING, status, executedAt, errorMessage, Instant.now());
    }
}
