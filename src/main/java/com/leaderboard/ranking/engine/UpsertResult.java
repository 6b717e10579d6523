package com.leaderboard.ranking.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Outcome of {@link ScorePartition#upsert(String, long)}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UpsertResult {

    public enum Status {
        /** The entity holds a position after the call. */
        ADMITTED,
        /** The entity held a position and left it because its score dropped to zero. */
        REMOVED,
        /** The entity was absent and submitted zero; nothing to rank. */
        UNRANKED,
        /** The partition is full and the score does not beat the lowest held score. */
        NOT_ADMITTED
    }

    Status status;
    String entity;
    long score;
    int rank;
    String evicted;

    static UpsertResult admitted(String entity, long score, int rank, String evicted) {
        return new UpsertResult(Status.ADMITTED, entity, score, rank, evicted);
    }

    static UpsertResult removed(String entity) {
        return new UpsertResult(Status.REMOVED, entity, 0L, 0, null);
    }

    static UpsertResult unranked(String entity) {
        return new UpsertResult(Status.UNRANKED, entity, 0L, 0, null);
    }

    static UpsertResult notAdmitted(String entity, long score) {
        return new UpsertResult(Status.NOT_ADMITTED, entity, score, 0, null);
    }

    public boolean isAdmitted() {
        return status == Status.ADMITTED;
    }

    public boolean isNotAdmitted() {
        return status == Status.NOT_ADMITTED;
    }

    public OptionalInt rankPosition() {
        return isAdmitted() ? OptionalInt.of(rank) : OptionalInt.empty();
    }

    public Optional<String> evictedEntity() {
        return Optional.ofNullable(evicted);
    }
}
