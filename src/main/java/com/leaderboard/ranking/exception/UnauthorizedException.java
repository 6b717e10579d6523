package com.leaderboard.ranking.exception;

public class UnauthorizedException extends LeaderboardException {
    public UnauthorizedException(String message) {
        super(message, "UNAUTHORIZED");
    }
}
