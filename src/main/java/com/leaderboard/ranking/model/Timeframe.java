package com.leaderboard.ranking.model;

import com.leaderboard.ranking.exception.InvalidTimeframeException;

import java.util.Locale;

public enum Timeframe {
    DAILY,
    WEEKLY,
    MONTHLY,
    ALL_TIME;

    /**
     * Resolve a timeframe from its name (case-insensitive) or its ordinal index.
     */
    public static Timeframe parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidTimeframeException("Timeframe cannot be null or empty");
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            int ordinal = trimmed.length() > 9 ? -1 : Integer.parseInt(trimmed);
            if (ordinal < 0 || ordinal >= values().length) {
                throw new InvalidTimeframeException("Timeframe index out of range: " + trimmed);
            }
            return values()[ordinal];
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidTimeframeException("Unknown timeframe: " + trimmed);
        }
    }
}
