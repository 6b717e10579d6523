package com.leaderboard.ranking.service;

import com.leaderboard.ranking.engine.ActivityMask;
import com.leaderboard.ranking.engine.AggregationStrategy;
import com.leaderboard.ranking.engine.GlobalRecord;
import com.leaderboard.ranking.engine.ScorePartition;
import com.leaderboard.ranking.model.DailyStreakStats;
import com.leaderboard.ranking.model.StreakType;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Everything the streak statistics own, in one place.
 * <ul>
 *   <li>{@code activity}: one bit per streak type; its counter is the number of active streakers.</li>
 *   <li>{@code typeCounts}: entities holding each streak type bit.</li>
 *   <li>{@code longestStreak}: best-ever sum of an entity's current streaks, plus the per-type leaders.</li>
 *   <li>{@code boards}: one bounded leaderboard per streak type.</li>
 *   <li>{@code userLongestStreak}: longest single streak each entity ever reported; never decreases.</li>
 *   <li>{@code totalStreakDays}: sum of every entity's current streak total, saturating.</li>
 *   <li>{@code daily}: per UTC day counters of streak reports.</li>
 *   <li>{@code achievements}: per entity achievement totals.</li>
 * </ul>
 * The counters ({@code activity} counter, {@code typeCounts}, {@code totalStreakDays}) restart from zero
 * on {@link #resetAggregates()} and never go below zero afterwards.
 */
class StreakAggregateState {

    final ActivityMask activity;
    final GlobalRecord<StreakType> longestStreak;
    final Map<StreakType, ScorePartition> boards = new EnumMap<>(StreakType.class);
    final Map<StreakType, Long> typeCounts = new EnumMap<>(StreakType.class);
    final Map<String, Long> userLongestStreak = new HashMap<>();
    final Map<LocalDate, DailyCounter> daily = new HashMap<>();
    final Map<String, AchievementTotals> achievements = new HashMap<>();
    long totalStreakDays;

    StreakAggregateState(int boardSize, Duration inactivityThreshold, Clock clock) {
        this.activity = new ActivityMask(StreakType.values().length, inactivityThreshold, clock);
        this.longestStreak = new GlobalRecord<>(AggregationStrategy.SUM_OF_COMPONENTS);
        for (StreakType type : StreakType.values()) {
            boards.put(type, new ScorePartition("streak:" + type.name(), boardSize));
            typeCounts.put(type, 0L);
        }
    }

    void adjustTotalStreakDays(long before, long after) {
        if (after >= before) {
            long delta = after - before;
            totalStreakDays = totalStreakDays > Long.MAX_VALUE - delta ? Long.MAX_VALUE : totalStreakDays + delta;
        } else {
            totalStreakDays = Math.max(0L, totalStreakDays - (before - after));
        }
    }

    /**
     * Move the per-type counts for every bit that differs between the two masks.
     */
    void countTypeTransitions(long previousMask, long currentMask) {
        for (StreakType type : StreakType.values()) {
            boolean was = (previousMask & type.mask()) != 0L;
            boolean is = (currentMask & type.mask()) != 0L;
            if (!was && is) {
                typeCounts.merge(type, 1L, Long::sum);
            } else if (was && !is) {
                typeCounts.computeIfPresent(type, (key, count) -> Math.max(0L, count - 1));
            }
        }
    }

    DailyCounter dailyCounter(LocalDate day) {
        return daily.computeIfAbsent(day, DailyCounter::new);
    }

    AchievementTotals achievementsOf(String entity) {
        return achievements.getOrDefault(entity, AchievementTotals.NONE);
    }

    /**
     * Clear every leaderboard, the records and the global counters. Per-entity state (streak components,
     * longest streak, activity masks, achievements) and the daily history are kept.
     *
     * @return number of leaderboard entries dropped
     */
    int resetAggregates() {
        int cleared = 0;
        for (ScorePartition board : boards.values()) {
            cleared += board.size();
            board.clear();
        }
        typeCounts.replaceAll((type, count) -> 0L);
        activity.resetCounter();
        longestStreak.resetBests();
        totalStreakDays = 0L;
        return cleared;
    }

    static class DailyCounter {
        final LocalDate day;
        final Set<String> activeUsers = new HashSet<>();
        long totalActivities;
        long newStreakers;

        DailyCounter(LocalDate day) {
            this.day = day;
        }

        DailyStreakStats snapshot() {
            return DailyStreakStats.builder()
                .day(day)
                .activeUsers(activeUsers.size())
                .totalActivities(totalActivities)
                .newStreakers(newStreakers)
                .build();
        }
    }

    @Value
    static class AchievementTotals {
        static final AchievementTotals NONE = new AchievementTotals(0L, 0L, 0L);

        long count;
        long xpEarned;
        long badgesEarned;

        AchievementTotals plus(long xp, long badges) {
            return new AchievementTotals(saturatingAdd(count, 1L), saturatingAdd(xpEarned, xp),
                saturatingAdd(badgesEarned, badges));
        }

        private static long saturatingAdd(long a, long b) {
            return a > Long.MAX_VALUE - b ? Long.MAX_VALUE : a + b;
        }
    }
}
