package com.leaderboard.ranking.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-entity set of active categories plus the number of entities with at least one
 * active category.
 * <p>
 * The counter moves only when a mask crosses between zero and non-zero, so it equals the number
 * of entities whose mask is non-zero. After {@link #resetCounter()} it counts only entities that
 * became active since, and never drops below zero. Not thread-safe; callers serialize access.
 */
public class ActivityMask {

    private final int categoryCount;
    private final Duration inactivityThreshold;
    private final Clock clock;
    private final Map<String, ActivityRecord> records = new HashMap<>();
    private long totalActive;

    public ActivityMask(int categoryCount, Duration inactivityThreshold, Clock clock) {
        if (categoryCount < 1 || categoryCount > Long.SIZE) {
            throw new IllegalArgumentException("Category count must be between 1 and " + Long.SIZE);
        }
        if (inactivityThreshold == null || inactivityThreshold.isNegative()) {
            throw new IllegalArgumentException("Inactivity threshold must be a non-negative duration");
        }
        this.categoryCount = categoryCount;
        this.inactivityThreshold = inactivityThreshold;
        this.clock = clock;
    }

    /**
     * Set or clear one category bit. Setting a bit also refreshes the entity's last activity time.
     */
    public ActivityTransition setCategoryActive(String entity, int categoryBit, boolean active) {
        if (entity == null || entity.trim().isEmpty()) {
            throw new IllegalArgumentException("Entity cannot be null or empty");
        }
        if (categoryBit < 0 || categoryBit >= categoryCount) {
            throw new IllegalArgumentException("Category bit out of range: " + categoryBit);
        }

        ActivityRecord record = records.get(entity);
        long before = record == null ? 0L : record.getBitmask();
        long flag = 1L << categoryBit;
        long after = active ? before | flag : before & ~flag;

        if (record == null) {
            if (after == 0L) {
                return new ActivityTransition(entity, 0L, 0L, 0, totalActive);
            }
            record = new ActivityRecord(entity, 0L, null);
            records.put(entity, record);
        }
        record.setBitmask(after);
        if (active) {
            record.setLastActivityTimestamp(clock.instant());
        }

        int delta = 0;
        if (before == 0L && after != 0L) {
            totalActive++;
            delta = 1;
        } else if (before != 0L && after == 0L && totalActive > 0) {
            totalActive--;
            delta = -1;
        }
        return new ActivityTransition(entity, before, after, delta, totalActive);
    }

    /**
     * Force the mask of every listed entity idle for longer than the inactivity threshold to zero.
     * Entities already inactive, never seen or recently active are left alone.
     *
     * @return the entities that were deactivated
     */
    public List<String> cleanup(Collection<String> entities) {
        Instant cutoff = clock.instant().minus(inactivityThreshold);
        List<String> deactivated = new ArrayList<>();
        for (String entity : entities) {
            ActivityRecord record = records.get(entity);
            if (record == null || !record.isActive()) {
                continue;
            }
            Instant last = record.getLastActivityTimestamp();
            if (last != null && !last.isBefore(cutoff)) {
                continue;
            }
            record.setBitmask(0L);
            if (totalActive > 0) {
                totalActive--;
            }
            deactivated.add(entity);
        }
        return deactivated;
    }

    /**
     * Zero the active counter. Masks and timestamps are kept.
     */
    public void resetCounter() {
        totalActive = 0L;
    }

    public boolean isActive(String entity) {
        return activeCategories(entity) != 0L;
    }

    public long activeCategories(String entity) {
        ActivityRecord record = records.get(entity);
        return record == null ? 0L : record.getBitmask();
    }

    public Optional<Instant> lastActivity(String entity) {
        ActivityRecord record = records.get(entity);
        return record == null ? Optional.empty() : Optional.ofNullable(record.getLastActivityTimestamp());
    }

    public long totalActive() {
        return totalActive;
    }

    public int getCategoryCount() {
        return categoryCount;
    }
}
