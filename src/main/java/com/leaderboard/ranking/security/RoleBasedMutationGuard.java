package com.leaderboard.ranking.security;

import com.leaderboard.ranking.config.RankingProperties;
import com.leaderboard.ranking.exception.EnforcedPauseException;
import com.leaderboard.ranking.exception.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Grants roles from the {@code ranking.security} lists. Admins hold every role.
 */
@Component
public class RoleBasedMutationGuard implements MutationGuard {

    private static final Logger logger = LoggerFactory.getLogger(RoleBasedMutationGuard.class);

    private final boolean enabled;
    private final Map<Role, Set<String>> members = new EnumMap<>(Role.class);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    @Autowired
    public RoleBasedMutationGuard(RankingProperties properties) {
        RankingProperties.Security security = properties.getSecurity();
        this.enabled = security.isEnabled();
        members.put(Role.ADMIN, toSet(security.getAdmins()));
        members.put(Role.SCORE_MANAGER, toSet(security.getScoreManagers()));
        members.put(Role.STATS_MANAGER, toSet(security.getStatsManagers()));
    }

    @Override
    public void authorize(String caller, Operation operation) {
        if (enabled && !hasRole(caller, operation.getRequiredRole())) {
            logger.warn("Rejected {} from caller {}: missing role {}", operation, caller, operation.getRequiredRole());
            throw new UnauthorizedException("Caller " + caller + " lacks role " + operation.getRequiredRole());
        }
        if (operation.isPausable() && paused.get()) {
            throw new EnforcedPauseException("Writes are paused");
        }
    }

    @Override
    public void pause() {
        if (paused.compareAndSet(false, true)) {
            logger.info("Ranking writes paused");
        }
    }

    @Override
    public void unpause() {
        if (paused.compareAndSet(true, false)) {
            logger.info("Ranking writes resumed");
        }
    }

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    private boolean hasRole(String caller, Role role) {
        if (caller == null || caller.trim().isEmpty()) {
            return false;
        }
        return members.get(Role.ADMIN).contains(caller) || members.get(role).contains(caller);
    }

    private static Set<String> toSet(List<String> callers) {
        return callers == null ? new HashSet<>() : new HashSet<>(callers);
    }
}
