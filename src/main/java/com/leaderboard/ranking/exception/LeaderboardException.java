package com.leaderboard.ranking.exception;

/**
 * Base of every failure raised by the ranking services. The error code travels to the
 * REST error body unchanged.
 */
public class LeaderboardException extends RuntimeException {
    private final String errorCode;

    public LeaderboardException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public LeaderboardException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
