package com.leaderboard.ranking.exception;

public class InvalidCategoryException extends InvalidRequestException {
    public InvalidCategoryException(String message) {
        super(message, "INVALID_CATEGORY");
    }
}
