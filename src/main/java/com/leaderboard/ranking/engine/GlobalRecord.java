package com.leaderboard.ranking.engine;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Best value ever observed together with the entity that first reached it, overall and per
 * category. The best value never decreases and a tie never replaces the holder.
 * <p>
 * With {@link AggregationStrategy#SUM_OF_COMPONENTS} each category acts as a named component of
 * the entity, and the entity's component sum (saturating at {@link Long#MAX_VALUE}) is what gets
 * compared against the overall best. Per-category bests always compare the raw observed value.
 * <p>
 * Not thread-safe; callers serialize access.
 *
 * @param <C> category type
 */
public class GlobalRecord<C> {

    private final AggregationStrategy strategy;
    private RecordHolder best = RecordHolder.EMPTY;
    private final Map<C, RecordHolder> categoryBest = new LinkedHashMap<>();
    private final Map<String, Map<C, Long>> components = new HashMap<>();

    public GlobalRecord(AggregationStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("Aggregation strategy cannot be null");
        }
        this.strategy = strategy;
    }

    public RecordObservation<C> observe(String entity, C category, long value) {
        if (entity == null || entity.trim().isEmpty()) {
            throw new IllegalArgumentException("Entity cannot be null or empty");
        }
        if (value < 0) {
            throw new IllegalArgumentException("Observed value cannot be negative: " + value);
        }
        if (strategy == AggregationStrategy.SUM_OF_COMPONENTS && category == null) {
            throw new IllegalArgumentException("A component category is required for " + strategy);
        }

        long aggregate = strategy == AggregationStrategy.PER_EVENT ? value : updateComponent(entity, category, value);

        boolean newLeader = false;
        if (aggregate > best.getValue()) {
            best = new RecordHolder(aggregate, entity);
            newLeader = true;
        }

        boolean newCategoryLeader = false;
        if (category != null) {
            RecordHolder current = categoryBest.getOrDefault(category, RecordHolder.EMPTY);
            if (value > current.getValue()) {
                categoryBest.put(category, new RecordHolder(value, entity));
                newCategoryLeader = true;
            }
        }
        return new RecordObservation<>(entity, category, value, aggregate, newLeader, newCategoryLeader);
    }

    /**
     * Current component sum of {@code entity}; always zero with {@link AggregationStrategy#PER_EVENT}.
     */
    public long totalOf(String entity) {
        Map<C, Long> parts = components.get(entity);
        return parts == null ? 0L : sum(parts);
    }

    /**
     * Forget every component of {@code entity}. Bests already reached are kept.
     *
     * @return the component sum the entity had before
     */
    public long clearComponents(String entity) {
        Map<C, Long> parts = components.remove(entity);
        return parts == null ? 0L : sum(parts);
    }

    /**
     * Forget the overall and per-category bests. Entity components are kept.
     */
    public void resetBests() {
        best = RecordHolder.EMPTY;
        categoryBest.clear();
    }

    public RecordHolder getBest() {
        return best;
    }

    public RecordHolder getCategoryBest(C category) {
        return categoryBest.getOrDefault(category, RecordHolder.EMPTY);
    }

    public Map<C, RecordHolder> getCategoryBests() {
        return Collections.unmodifiableMap(categoryBest);
    }

    public AggregationStrategy getStrategy() {
        return strategy;
    }

    private long updateComponent(String entity, C category, long value) {
        Map<C, Long> parts = components.computeIfAbsent(entity, key -> new HashMap<>());
        if (value == 0L) {
            parts.remove(category);
        } else {
            parts.put(category, value);
        }
        if (parts.isEmpty()) {
            components.remove(entity);
            return 0L;
        }
        return sum(parts);
    }

    private static <K> long sum(Map<K, Long> parts) {
        long total = 0L;
        for (long part : parts.values()) {
            total = total > Long.MAX_VALUE - part ? Long.MAX_VALUE : total + part;
        }
        return total;
    }
}
