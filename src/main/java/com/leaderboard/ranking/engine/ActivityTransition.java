package com.leaderboard.ranking.engine;

import lombok.Value;

/**
 * Result of a single bit change on an entity's activity mask. {@code counterDelta} is +1 when the
 * entity became active, -1 when it became inactive and 0 otherwise.
 */
@Value
public class ActivityTransition {
    String entity;
    long previousMask;
    long currentMask;
    int counterDelta;
    long totalActive;

    public boolean maskChanged() {
        return previousMask != currentMask;
    }

    public boolean counterChanged() {
        return counterDelta != 0;
    }
}
