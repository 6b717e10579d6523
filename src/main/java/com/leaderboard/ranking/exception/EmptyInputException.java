package com.leaderboard.ranking.exception;

public class EmptyInputException extends InvalidRequestException {
    public EmptyInputException(String message) {
        super(message, "EMPTY_INPUT");
    }
}
