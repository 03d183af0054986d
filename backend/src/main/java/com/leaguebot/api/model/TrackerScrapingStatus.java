package com.leaguebot.api.model;

public enum TrackerScrapingStatus { PENDING, IN_PROGRESS, COMPLETED, FAILED }
