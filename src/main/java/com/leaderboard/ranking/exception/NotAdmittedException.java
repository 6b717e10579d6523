package com.leaderboard.ranking.exception;

public class NotAdmittedException extends RejectedUpdateException {
    public NotAdmittedException(String message) {
        super(message, "NOT_ADMITTED");
    }
}
