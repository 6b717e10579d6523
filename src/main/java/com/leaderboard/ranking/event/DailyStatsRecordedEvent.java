package com.leaderboard.ranking.event;

import lombok.Value;

import java.time.LocalDate;

@Value
public class DailyStatsRecordedEvent {
    LocalDate day;
    long activeUsers;
    long totalActivities;
    long newStreakers;
}
