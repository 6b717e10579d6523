package com.leaderboard.ranking.exception;

public class EnforcedPauseException extends LeaderboardException {
    public EnforcedPauseException(String message) {
        super(message, "ENFORCED_PAUSE");
    }
}
