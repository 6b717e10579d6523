package com.leaderboard.ranking.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Audit trail of committed ranking changes. Badge and XP issuers subscribe to the same events.
 */
@Component
public class LeaderboardEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardEventLogger.class);

    @EventListener
    public void onScoreUpdated(ScoreUpdatedEvent event) {
        logger.debug("ScoreUpdated - entity: {}, board: {}:{}, score: {}, rank: {}",
            event.getEntity(), event.getCategory(), event.getTimeframe(), event.getScore(), event.getRank());
    }

    @EventListener
    public void onNewLeader(NewLeaderEvent event) {
        logger.info("NewLeader - scope: {}, entity: {}, category: {}, timeframe: {}, value: {}",
            event.getScope(), event.getEntity(), event.getCategory(), event.getTimeframe(), event.getValue());
    }

    @EventListener
    public void onLeaderboardUpdated(LeaderboardUpdatedEvent event) {
        logger.debug("LeaderboardUpdated - entity: {}, streakType: {}, rank: {}, score: {}",
            event.getEntity(), event.getStreakType(), event.getNewRank(), event.getScore());
    }

    @EventListener
    public void onLeaderboardReset(LeaderboardResetEvent event) {
        logger.info("LeaderboardReset - board: {}:{}, cleared entries: {}",
            event.getCategory(), event.getTimeframe(), event.getClearedEntries());
    }

    @EventListener
    public void onActiveCountChanged(ActiveCountChangedEvent event) {
        logger.debug("ActiveCountChanged - tracker: {}, total: {}", event.getTracker(), event.getNewTotal());
    }

    @EventListener
    public void onDailyStatsRecorded(DailyStatsRecordedEvent event) {
        logger.debug("DailyStatsRecorded - day: {}, active users: {}, activities: {}, new streakers: {}",
            event.getDay(), event.getActiveUsers(), event.getTotalActivities(), event.getNewStreakers());
    }

    @EventListener
    public void onAchievementRecorded(AchievementRecordedEvent event) {
        logger.info("AchievementRecorded - entity: {}, xp: {}, badges: {}, total achievements: {}",
            event.getEntity(), event.getXpEarned(), event.getBadgesEarned(), event.getTotalAchievements());
    }

    @EventListener
    public void onStreakStatsReset(StreakStatsResetEvent event) {
        logger.info("StreakStatsReset - cleared entries: {}", event.getClearedEntries());
    }
}
