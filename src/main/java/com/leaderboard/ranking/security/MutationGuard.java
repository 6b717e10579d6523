package com.leaderboard.ranking.security;

/**
 * Capability check run before every mutating entry point. Reads are never guarded.
 */
public interface MutationGuard {

    // request header carrying the caller identity
    String CALLER_HEADER = "X-Caller-Id";

    /**
     * @throws com.leaderboard.ranking.exception.UnauthorizedException when {@code caller} lacks the role
     * @throws com.leaderboard.ranking.exception.EnforcedPauseException when writes are paused
     */
    void authorize(String caller, Operation operation);

    void pause();

    void unpause();

    boolean isPaused();
}
