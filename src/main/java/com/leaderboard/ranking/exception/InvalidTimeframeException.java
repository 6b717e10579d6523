package com.leaderboard.ranking.exception;

public class InvalidTimeframeException extends InvalidRequestException {
    public InvalidTimeframeException(String message) {
        super(message, "INVALID_TIMEFRAME");
    }
}
