package com.leaderboard.ranking.event;

import com.leaderboard.ranking.model.StreakType;
import lombok.Value;

@Value
public class LeaderboardUpdatedEvent {
    String entity;
    StreakType streakType;
    int newRank;
    long score;
}
