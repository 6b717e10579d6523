package com.leaderboard.ranking.exception;

public class LeaderboardInactiveException extends RejectedUpdateException {
    public LeaderboardInactiveException(String message) {
        super(message, "LEADERBOARD_INACTIVE");
    }
}
