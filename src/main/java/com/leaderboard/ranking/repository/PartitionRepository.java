package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.engine.ScorePartition;
import com.leaderboard.ranking.model.PartitionKey;

import java.util.Optional;

public interface PartitionRepository {
    ScorePartition save(PartitionKey key, ScorePartition partition);
    Optional<ScorePartition> findByKey(PartitionKey key);
}
