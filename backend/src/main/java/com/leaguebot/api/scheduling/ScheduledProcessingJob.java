package com.leaguebot.api.scheduling;

public final class ScheduledProcessingJob implements TimedJob {

    public static final String JOB_ID_PREFIX = "scheduled-processing-";

    private final String scheduleId;
    private final String guildId;
    private final ScheduledProcessingExecutor executor;

    public ScheduledProcessingJob(String scheduleId, String guildId, ScheduledProcessingExecutor executor) {
        this.scheduleId = scheduleId;
        this.guildId = guildId;
        this.executor = executor;
    }

    public static String jobIdFor(String scheduleId) {
        return JOB_ID_PREFIX + scheduleId;
    }

    public String getJobId() { return jobIdFor(scheduleId); }

    @Override
    public void execute() {
        executor.executeSchedule(scheduleId, guildId);
    }

    @Override
    public String toString() {
        return "ScheduledProcessingJob{scheduleId=" + scheduleId + ", guildId=" + guildId + "}";
    }
}
