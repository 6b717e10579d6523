package com.leaderboard.ranking.event;

import lombok.Value;

/**
 * The number of active entities changed. {@code tracker} names the activity mask that moved.
 */
@Value
public class ActiveCountChangedEvent {
    String tracker;
    long newTotal;
}
