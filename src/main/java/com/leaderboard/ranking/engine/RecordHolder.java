package com.leaderboard.ranking.engine;

import lombok.Value;

import java.util.Optional;

@Value
public class RecordHolder {
    public static final RecordHolder EMPTY = new RecordHolder(0L, null);

    long value;
    String holder;

    public Optional<String> holderEntity() {
        return Optional.ofNullable(holder);
    }
}
