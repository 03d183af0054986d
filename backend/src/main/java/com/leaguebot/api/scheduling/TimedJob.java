package com.leaguebot.api.scheduling;

@FunctionalInterface
public interface TimedJob {
    void execute();
}
