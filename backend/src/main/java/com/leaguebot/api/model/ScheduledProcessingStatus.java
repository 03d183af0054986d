package com.leaguebot.api.model;

/**
 * Lifecycle of a scheduled guild refresh. Only {@link #PENDING} may transition;
 * the other three values are terminal.
 */
public enum ScheduledProcessingStatus {
    PENDING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
