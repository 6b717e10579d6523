package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Streak reports of one UTC day. {@code newStreakers} counts entities that went from no active
 * streak to at least one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStreakStats {
    private LocalDate day;
    private long activeUsers;
    private long totalActivities;
    private long newStreakers;
}
