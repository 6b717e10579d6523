package com.leaderboard.ranking.model;

import com.leaderboard.ranking.exception.InvalidCategoryException;

import java.util.Locale;

public enum LeaderboardCategory {
    XP_TOTAL,
    TRADING_VOLUME,
    QUEST_COMPLETION,
    GOVERNANCE_PARTICIPATION,
    REFERRAL_COUNT,
    STREAK_LENGTH,
    GUILD_CONTRIBUTION,
    SOCIAL_ENGAGEMENT;

    /**
     * Resolve a category from its name (case-insensitive) or its ordinal index.
     */
    public static LeaderboardCategory parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidCategoryException("Category cannot be null or empty");
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            int ordinal = trimmed.length() > 9 ? -1 : Integer.parseInt(trimmed);
            if (ordinal < 0 || ordinal >= values().length) {
                throw new InvalidCategoryException("Category index out of range: " + trimmed);
            }
            return values()[ordinal];
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidCategoryException("Unknown category: " + trimmed);
        }
    }
}
