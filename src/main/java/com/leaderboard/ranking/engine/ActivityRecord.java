package com.leaderboard.ranking.engine;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivityRecord {
    private String entity;
    private long bitmask;
    private Instant lastActivityTimestamp;

    public boolean isActive() {
        return bitmask != 0L;
    }
}
