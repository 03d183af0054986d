package com.leaguebot.api.exception;

// mapped to 503; pending schedules are still being restored
public class SchedulerNotReadyException extends RuntimeException {

    public SchedulerNotReadyException(String message) {
        super(message);
    }
}
