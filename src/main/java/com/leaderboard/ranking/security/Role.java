package com.leaderboard.ranking.security;

public enum Role {
    ADMIN,
    SCORE_MANAGER,
    STATS_MANAGER
}
