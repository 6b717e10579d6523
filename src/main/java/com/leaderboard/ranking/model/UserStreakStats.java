package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserStreakStats {
    private String entity;
    private long totalStreakDays;
    private long longestStreak;
    private boolean active;
    private long activeTypes;
    private Instant lastActivity;
    private long totalAchievements;
    private long totalXpEarned;
    private long totalBadgesEarned;
}
