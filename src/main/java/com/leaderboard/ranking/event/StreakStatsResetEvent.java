package com.leaderboard.ranking.event;

import lombok.Value;

/**
 * Streak aggregates were reset. {@code clearedEntries} is the number of leaderboard entries dropped
 * across all streak types.
 */
@Value
public class StreakStatsResetEvent {
    int clearedEntries;
}
