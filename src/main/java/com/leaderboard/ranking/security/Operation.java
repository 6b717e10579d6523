package com.leaderboard.ranking.security;

/**
 * Mutating entry points subject to the capability check.
 */
public enum Operation {
    UPDATE_SCORE(Role.SCORE_MANAGER, true),
    UPDATE_ACTIVITY(Role.STATS_MANAGER, true),
    RECORD_ACHIEVEMENT(Role.STATS_MANAGER, true),
    RESET_LEADERBOARD(Role.ADMIN, false),
    CONFIGURE(Role.ADMIN, false),
    START_SEASON(Role.ADMIN, false),
    CLEANUP(Role.ADMIN, false),
    RESET_STATS(Role.ADMIN, false),
    PAUSE(Role.ADMIN, false);

    private final Role requiredRole;
    private final boolean pausable;

    Operation(Role requiredRole, boolean pausable) {
        this.requiredRole = requiredRole;
        this.pausable = pausable;
    }

    public Role getRequiredRole() {
        return requiredRole;
    }

    public boolean isPausable() {
        return pausable;
    }
}
