package com.leaderboard.ranking.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifies one bounded leaderboard partition. Every key owns a distinct bit of the
 * per-entity activity mask.
 */
@Value(staticConstructor = "of")
public class PartitionKey {
    public static final int ACTIVITY_BITS = LeaderboardCategory.values().length * Timeframe.values().length;

    @NonNull LeaderboardCategory category;
    @NonNull Timeframe timeframe;

    public int activityBit() {
        return category.ordinal() * Timeframe.values().length + timeframe.ordinal();
    }

    public String storageKey() {
        return category.name() + ":" + timeframe.name();
    }

    public static PartitionKey fromStorageKey(String storageKey) {
        int separator = storageKey.indexOf(':');
        if (separator < 0) {
            throw new IllegalArgumentException("Malformed partition key: " + storageKey);
        }
        return of(LeaderboardCategory.parse(storageKey.substring(0, separator)),
            Timeframe.parse(storageKey.substring(separator + 1)));
    }

    @Override
    public String toString() {
        return storageKey();
    }
}
