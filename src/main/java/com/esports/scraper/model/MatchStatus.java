package com.esports.scraper.model;

public enum MatchStatus {
    UPCOMING,
    LIVE,
    COMPLETED,
    UNKNOWN
}
