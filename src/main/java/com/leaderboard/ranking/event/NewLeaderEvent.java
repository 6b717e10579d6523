package com.leaderboard.ranking.event;

import lombok.Value;

/**
 * An entity took first place. {@code category} and {@code timeframe} are the names of the board
 * or record concerned; {@code timeframe} is null outside partition leadership.
 */
@Value
public class NewLeaderEvent {

    public enum Scope {
        PARTITION,
        GLOBAL_RECORD,
        CATEGORY_RECORD
    }

    Scope scope;
    String entity;
    String category;
    String timeframe;
    long value;
}
