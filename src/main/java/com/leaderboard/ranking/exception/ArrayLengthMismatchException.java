package com.leaderboard.ranking.exception;

public class ArrayLengthMismatchException extends InvalidRequestException {
    public ArrayLengthMismatchException(String message) {
        super(message, "ARRAY_LENGTH_MISMATCH");
    }
}
