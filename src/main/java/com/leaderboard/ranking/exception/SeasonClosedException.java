package com.leaderboard.ranking.exception;

public class SeasonClosedException extends RejectedUpdateException {
    public SeasonClosedException(String message) {
        super(message, "SEASON_CLOSED");
    }
}
