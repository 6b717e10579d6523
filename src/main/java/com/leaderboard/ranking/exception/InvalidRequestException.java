package com.leaderboard.ranking.exception;

public class InvalidRequestException extends LeaderboardException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    protected InvalidRequestException(String message, String errorCode) {
        super(message, errorCode);
    }
}
