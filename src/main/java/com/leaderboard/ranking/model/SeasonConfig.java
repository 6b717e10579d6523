package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Write settings of one partition. A zero {@code seasonDuration} means the season never closes;
 * a null {@code seasonStartTime} means the season is open from the beginning of time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SeasonConfig {
    private boolean active;
    private int maxEntries;

    @Builder.Default
    private Duration updateCooldown = Duration.ZERO;

    private Instant seasonStartTime;

    @Builder.Default
    private Duration seasonDuration = Duration.ZERO;

    public boolean isWithinSeason(Instant now) {
        if (seasonStartTime == null) {
            return true;
        }
        if (now.isBefore(seasonStartTime)) {
            return false;
        }
        return seasonDuration == null || seasonDuration.isZero()
            || now.isBefore(seasonStartTime.plus(seasonDuration));
    }
}
