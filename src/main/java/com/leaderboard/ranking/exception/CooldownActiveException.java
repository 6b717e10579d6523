package com.leaderboard.ranking.exception;

public class CooldownActiveException extends RejectedUpdateException {
    public CooldownActiveException(String message) {
        super(message, "COOLDOWN_ACTIVE");
    }
}
