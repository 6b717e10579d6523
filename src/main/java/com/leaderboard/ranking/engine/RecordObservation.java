package com.leaderboard.ranking.engine;

import lombok.Value;

@Value
public class RecordObservation<C> {
    String entity;
    C category;
    long value;
    long aggregate;
    boolean newLeader;
    boolean newCategoryLeader;
}
