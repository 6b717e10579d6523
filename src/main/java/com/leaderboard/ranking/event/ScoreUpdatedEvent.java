package com.leaderboard.ranking.event;

import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.Timeframe;
import lombok.Value;

import java.util.OptionalInt;

/**
 * A score write was committed. {@code rank} is empty when the entity holds no position afterwards.
 */
@Value
public class ScoreUpdatedEvent {
    String entity;
    LeaderboardCategory category;
    Timeframe timeframe;
    long score;
    OptionalInt rank;
}
