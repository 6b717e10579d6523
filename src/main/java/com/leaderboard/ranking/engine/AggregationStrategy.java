package com.leaderboard.ranking.engine;

/**
 * How {@link GlobalRecord} derives the value compared against its best.
 */
public enum AggregationStrategy {
    /** The observed value is compared as is. */
    PER_EVENT,
    /** The observed value replaces one named component of the entity; the sum of its components is compared. */
    SUM_OF_COMPONENTS
}
