package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.engine.ScorePartition;
import com.leaderboard.ranking.model.PartitionKey;
import com.leaderboard.ranking.repository.PartitionRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Partitions held in process memory. The stored instance is live: mutations made through it are
 * visible to later lookups without another save.
 */
@Repository
public class InMemoryPartitionRepository implements PartitionRepository {

    private final Map<PartitionKey, ScorePartition> partitions = new ConcurrentHashMap<>();

    @Override
    public ScorePartition save(PartitionKey key, ScorePartition partition) {
        if (key == null) {
            throw new IllegalArgumentException("Partition key cannot be null");
        }
        if (partition == null) {
            throw new IllegalArgumentException("Partition cannot be null");
        }
        partitions.put(key, partition);
        return partition;
    }

    @Override
    public Optional<ScorePartition> findByKey(PartitionKey key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(partitions.get(key));
    }
}
