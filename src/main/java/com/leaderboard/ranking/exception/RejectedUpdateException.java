package com.leaderboard.ranking.exception;

/**
 * A well-formed write that the current partition state refuses. Nothing is changed when it is thrown.
 */
public class RejectedUpdateException extends LeaderboardException {
    public RejectedUpdateException(String message, String errorCode) {
        super(message, errorCode);
    }
}
