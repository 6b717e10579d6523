package com.leaderboard.ranking.exception;

public class ScoreOverflowException extends InvalidRequestException {
    public ScoreOverflowException(String message) {
        super(message, "SCORE_OVERFLOW");
    }
}
