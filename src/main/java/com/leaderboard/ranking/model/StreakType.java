package com.leaderboard.ranking.model;

import com.leaderboard.ranking.exception.InvalidCategoryException;

import java.util.Locale;

/**
 * Streak categories tracked by the streak statistics. Each type owns one bit of an entity's
 * activity mask: DAILY_LOGIN is 1, QUEST_COMPLETION is 2, TRADING is 4 and so on.
 */
public enum StreakType {
    DAILY_LOGIN,
    QUEST_COMPLETION,
    TRADING,
    GOVERNANCE,
    SOCIAL_INTERACTION;

    public int bit() {
        return ordinal();
    }

    public long mask() {
        return 1L << ordinal();
    }

    public static StreakType parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidCategoryException("Streak type cannot be null or empty");
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            int ordinal = trimmed.length() > 9 ? -1 : Integer.parseInt(trimmed);
            if (ordinal < 0 || ordinal >= values().length) {
                throw new InvalidCategoryException("Streak type index out of range: " + trimmed);
            }
            return values()[ordinal];
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidCategoryException("Unknown streak type: " + trimmed);
        }
    }
}
