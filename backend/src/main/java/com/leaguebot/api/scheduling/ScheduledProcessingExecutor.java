package com.leaguebot.api.scheduling;

public interface ScheduledProcessingExecutor {
    void executeSchedule(String scheduleId, String guildId);
}
