package com.leaguebot.api.exception;

import com.leaguebot.api.model.ScheduledProcessingStatus;

// mapped to 409
public class ScheduleStateException extends RuntimeException {

    private final String scheduleId;
    private final ScheduledProcessingStatus status;

    public ScheduleStateException(String scheduleId, ScheduledProcessingStatus status, String message) {
        super(message);
        this.scheduleId = scheduleId;
        this.status = status;
    }

    public String getScheduleId() { return scheduleId; }
    public ScheduledProcessingStatus getStatus() { return status; }
}
