package com.leaguebot.api.service;

import java.util.List;

/**
 * Drops trackers that another worker is already processing. Returns a subset of the input
 * in input order and never claims anything itself.
 */
public interface TrackerProcessingGuard {
    List<String> filterProcessable(List<String> trackerIds);
}
