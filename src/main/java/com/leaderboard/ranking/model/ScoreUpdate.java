package com.leaderboard.ranking.model;

import lombok.Builder;
import lombok.Value;

import java.util.OptionalInt;

/**
 * Committed result of a score write. {@code rank} is empty when the entity holds no position.
 */
@Value
@Builder
public class ScoreUpdate {
    String entity;
    LeaderboardCategory category;
    Timeframe timeframe;
    long score;
    @Builder.Default
    OptionalInt rank = OptionalInt.empty();
    String evicted;
}
