package com.leaderboard.ranking.model;

import lombok.Builder;
import lombok.Value;

import java.util.OptionalInt;

/**
 * Result of one streak activity report. {@code admitted} is false when the streak-type board is
 * full and the streak does not beat its lowest entry; activity and records are still applied.
 */
@Value
@Builder
public class StreakActivityResult {
    String entity;
    StreakType streakType;
    long currentStreak;
    long activeTypes;
    boolean active;
    @Builder.Default
    OptionalInt rank = OptionalInt.empty();
    boolean admitted;
    long currentTotal;
}
