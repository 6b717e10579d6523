package com.leaderboard.ranking.service;

import com.leaderboard.ranking.config.RankingProperties;
import com.leaderboard.ranking.engine.ActivityTransition;
import com.leaderboard.ranking.engine.RecordHolder;
import com.leaderboard.ranking.engine.RecordObservation;
import com.leaderboard.ranking.engine.ScorePartition;
import com.leaderboard.ranking.engine.UpsertResult;
import com.leaderboard.ranking.event.AchievementRecordedEvent;
import com.leaderboard.ranking.event.ActiveCountChangedEvent;
import com.leaderboard.ranking.event.DailyStatsRecordedEvent;
import com.leaderboard.ranking.event.LeaderboardUpdatedEvent;
import com.leaderboard.ranking.event.NewLeaderEvent;
import com.leaderboard.ranking.event.StreakStatsResetEvent;
import com.leaderboard.ranking.exception.EmptyInputException;
import com.leaderboard.ranking.exception.InvalidCategoryException;
import com.leaderboard.ranking.exception.InvalidRequestException;
import com.leaderboard.ranking.model.DailyStreakStats;
import com.leaderboard.ranking.model.GlobalStreakStats;
import com.leaderboard.ranking.model.RankedEntry;
import com.leaderboard.ranking.model.StreakActivityResult;
import com.leaderboard.ranking.model.StreakType;
import com.leaderboard.ranking.model.UserStreakStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Streak statistics: who is currently on a streak, the longest combined streak ever seen and
 * one bounded leaderboard per streak type.
 */
@Service
public class StreakStatisticsService {

    private static final Logger logger = LoggerFactory.getLogger(StreakStatisticsService.class);

    static final String ACTIVITY_TRACKER = "streaks";

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final StreakAggregateState state;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public StreakStatisticsService(RankingProperties properties, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        RankingProperties.Streaks streaks = properties.getStreaks();
        this.state = new StreakAggregateState(streaks.getLeaderboardSize(), streaks.getInactivityThreshold(), clock);
    }

    /**
     * Record the current streak of one type for an entity. A zero streak ends that type for the
     * entity and removes it from the type's leaderboard.
     */
    public StreakActivityResult updateUserActivity(String entity, StreakType streakType, long currentStreak) {
        validateEntity(entity);
        validateStreakType(streakType);
        if (currentStreak < 0) {
            throw new InvalidRequestException("Streak cannot be negative");
        }

        List<Object> events = new ArrayList<>();
        StreakActivityResult result;
        lock.lock();
        try {
            ScorePartition board = state.boards.get(streakType);
            String previousLeader = board.leader().orElse(null);
            UpsertResult ranking = board.upsert(entity, currentStreak);

            ActivityTransition transition = state.activity.setCategoryActive(entity, streakType.bit(), currentStreak > 0);
            state.countTypeTransitions(transition.getPreviousMask(), transition.getCurrentMask());
            if (transition.counterChanged()) {
                events.add(new ActiveCountChangedEvent(ACTIVITY_TRACKER, transition.getTotalActive()));
            }
            events.add(recordDailyActivity(entity, transition));

            long totalBefore = state.longestStreak.totalOf(entity);
            RecordObservation<StreakType> observation = state.longestStreak.observe(entity, streakType, currentStreak);
            state.adjustTotalStreakDays(totalBefore, observation.getAggregate());
            state.userLongestStreak.merge(entity, currentStreak, Math::max);

            if (ranking.isAdmitted()) {
                events.add(new LeaderboardUpdatedEvent(entity, streakType, ranking.getRank(), currentStreak));
                if (ranking.getRank() == 1 && !entity.equals(previousLeader)) {
                    events.add(new NewLeaderEvent(NewLeaderEvent.Scope.PARTITION, entity,
                        streakType.name(), null, currentStreak));
                }
            }
            if (observation.isNewLeader()) {
                events.add(new NewLeaderEvent(NewLeaderEvent.Scope.GLOBAL_RECORD, entity,
                    null, null, observation.getAggregate()));
            }
            if (observation.isNewCategoryLeader()) {
                events.add(new NewLeaderEvent(NewLeaderEvent.Scope.CATEGORY_RECORD, entity,
                    streakType.name(), null, currentStreak));
            }

            result = StreakActivityResult.builder()
                .entity(entity)
                .streakType(streakType)
                .currentStreak(currentStreak)
                .activeTypes(transition.getCurrentMask())
                .active(transition.getCurrentMask() != 0L)
                .rank(ranking.rankPosition())
                .admitted(!ranking.isNotAdmitted())
                .currentTotal(observation.getAggregate())
                .build();
        } finally {
            lock.unlock();
        }
        events.forEach(eventPublisher::publishEvent);

        if (!result.isAdmitted()) {
            logger.info("Streak {} of entity {} too short for the full {} leaderboard", currentStreak, entity, streakType);
        }
        logger.info("Updated {} streak of entity {} - streak: {}, total: {}, active types: {}",
            streakType, entity, currentStreak, result.getCurrentTotal(), result.getActiveTypes());
        return result;
    }

    /**
     * Deactivate the listed entities idle past the streak inactivity threshold. A deactivated entity
     * leaves every streak leaderboard and its streaks no longer count towards any total.
     *
     * @return the entities deactivated by this call
     */
    public List<String> cleanupInactiveStreakers(List<String> entities) {
        if (entities == null || entities.isEmpty()) {
            throw new EmptyInputException("Entities cannot be empty");
        }
        List<String> deactivated;
        long total;
        lock.lock();
        try {
            Map<String, Long> masksBefore = new LinkedHashMap<>();
            for (String entity : entities) {
                masksBefore.put(entity, state.activity.activeCategories(entity));
            }
            deactivated = state.activity.cleanup(entities);
            for (String entity : deactivated) {
                long maskBefore = masksBefore.get(entity);
                for (StreakType type : StreakType.values()) {
                    if ((maskBefore & type.mask()) != 0L) {
                        state.boards.get(type).remove(entity);
                    }
                }
                state.countTypeTransitions(maskBefore, 0L);
                state.adjustTotalStreakDays(state.longestStreak.clearComponents(entity), 0L);
            }
            total = state.activity.totalActive();
        } finally {
            lock.unlock();
        }
        if (!deactivated.isEmpty()) {
            eventPublisher.publishEvent(new ActiveCountChangedEvent(ACTIVITY_TRACKER, total));
        }
        logger.info("Streak cleanup checked {} entities - deactivated {}", entities.size(), deactivated.size());
        return deactivated;
    }

    /**
     * Record one achievement of an entity together with the XP and badges it earned.
     *
     * @return the entity's stats after the achievement
     */
    public UserStreakStats recordAchievement(String entity, long xpEarned, long badgesEarned) {
        validateEntity(entity);
        if (xpEarned < 0 || badgesEarned < 0) {
            throw new InvalidRequestException("Earned XP and badges cannot be negative");
        }

        StreakAggregateState.AchievementTotals totals;
        UserStreakStats stats;
        lock.lock();
        try {
            totals = state.achievementsOf(entity).plus(xpEarned, badgesEarned);
            state.achievements.put(entity, totals);
            stats = userStats(entity);
        } finally {
            lock.unlock();
        }
        eventPublisher.publishEvent(new AchievementRecordedEvent(entity, xpEarned, badgesEarned, totals.getCount()));
        logger.info("Recorded achievement for entity {} - xp: {}, badges: {}, achievements: {}",
            entity, xpEarned, badgesEarned, totals.getCount());
        return stats;
    }

    /**
     * Clear every streak leaderboard, the longest streak records and the global counters. Per-entity
     * totals, longest streaks, activity flags and achievements survive.
     */
    public void resetGlobalStats() {
        int cleared;
        lock.lock();
        try {
            cleared = state.resetAggregates();
        } finally {
            lock.unlock();
        }
        eventPublisher.publishEvent(new StreakStatsResetEvent(cleared));
        logger.info("Reset global streak statistics - cleared {} leaderboard entries", cleared);
    }

    /**
     * Rank of an entity on one streak type leaderboard; empty when it holds no position.
     */
    public OptionalInt getRank(String entity, StreakType streakType) {
        validateStreakType(streakType);
        return read(() -> state.boards.get(streakType).getRank(entity));
    }

    public long getStreakTypeCount(StreakType streakType) {
        validateStreakType(streakType);
        return read(() -> state.typeCounts.get(streakType));
    }

    /**
     * Streak report counters of one UTC day; all zero for a day without reports.
     */
    public DailyStreakStats getDailyStats(LocalDate day) {
        if (day == null) {
            throw new InvalidRequestException("Day cannot be null");
        }
        return read(() -> {
            StreakAggregateState.DailyCounter counter = state.daily.get(day);
            return counter == null ? DailyStreakStats.builder().day(day).build() : counter.snapshot();
        });
    }

    public List<RankedEntry> getLeaderboard(StreakType streakType, int limit) {
        validateStreakType(streakType);
        if (limit <= 0) {
            throw new InvalidRequestException("Limit must be greater than 0");
        }
        return read(() -> state.boards.get(streakType).getPage(0, limit));
    }

    public Map<StreakType, RecordHolder> getStreakTypeLeaders() {
        return read(() -> {
            Map<StreakType, RecordHolder> leaders = new EnumMap<>(StreakType.class);
            for (StreakType type : StreakType.values()) {
                leaders.put(type, state.longestStreak.getCategoryBest(type));
            }
            return leaders;
        });
    }

    public GlobalStreakStats getGlobalStats() {
        return read(() -> {
            RecordHolder best = state.longestStreak.getBest();
            return GlobalStreakStats.builder()
                .totalActiveStreakers(state.activity.totalActive())
                .longestGlobalStreak(best.getValue())
                .streakLeader(best.getHolder())
                .totalStreakDays(state.totalStreakDays)
                .streakTypeCounts(new EnumMap<>(state.typeCounts))
                .build();
        });
    }

    public UserStreakStats getUserStats(String entity) {
        return read(() -> userStats(entity));
    }

    public boolean isActiveStreaker(String entity) {
        return read(() -> state.activity.isActive(entity));
    }

    private UserStreakStats userStats(String entity) {
        StreakAggregateState.AchievementTotals totals = state.achievementsOf(entity);
        return UserStreakStats.builder()
            .entity(entity)
            .totalStreakDays(state.longestStreak.totalOf(entity))
            .longestStreak(state.userLongestStreak.getOrDefault(entity, 0L))
            .active(state.activity.isActive(entity))
            .activeTypes(state.activity.activeCategories(entity))
            .lastActivity(state.activity.lastActivity(entity).orElse(null))
            .totalAchievements(totals.getCount())
            .totalXpEarned(totals.getXpEarned())
            .totalBadgesEarned(totals.getBadgesEarned())
            .build();
    }

    private DailyStatsRecordedEvent recordDailyActivity(String entity, ActivityTransition transition) {
        StreakAggregateState.DailyCounter counter =
            state.dailyCounter(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
        counter.activeUsers.add(entity);
        counter.totalActivities++;
        if (transition.getPreviousMask() == 0L && transition.getCurrentMask() != 0L) {
            counter.newStreakers++;
        }
        return new DailyStatsRecordedEvent(counter.day, counter.activeUsers.size(),
            counter.totalActivities, counter.newStreakers);
    }

    private static void validateEntity(String entity) {
        if (entity == null || entity.trim().isEmpty()) {
            throw new InvalidRequestException("Entity cannot be null or empty");
        }
    }

    private static void validateStreakType(StreakType streakType) {
        if (streakType == null) {
            throw new InvalidCategoryException("Streak type cannot be null");
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }
}
