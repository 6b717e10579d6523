package com.leaderboard.ranking.event;

import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.Timeframe;
import lombok.Value;

@Value
public class LeaderboardResetEvent {
    LeaderboardCategory category;
    Timeframe timeframe;
    int clearedEntries;
}
