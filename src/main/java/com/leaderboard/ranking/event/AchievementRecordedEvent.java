package com.leaderboard.ranking.event;

import lombok.Value;

@Value
public class AchievementRecordedEvent {
    String entity;
    long xpEarned;
    long badgesEarned;
    long totalAchievements;
}
