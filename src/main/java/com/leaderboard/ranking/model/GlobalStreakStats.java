package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalStreakStats {
    private long totalActiveStreakers;
    private long longestGlobalStreak;
    private String streakLeader;
    private long totalStreakDays;
    /** Entities currently on a streak of each type. */
    private Map<StreakType, Long> streakTypeCounts;
}
