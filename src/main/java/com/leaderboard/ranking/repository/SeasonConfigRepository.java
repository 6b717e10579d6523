package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.model.PartitionKey;
import com.leaderboard.ranking.model.SeasonConfig;

import java.util.Map;
import java.util.Optional;

public interface SeasonConfigRepository {
    SeasonConfig save(PartitionKey key, SeasonConfig config);
    Optional<SeasonConfig> findByKey(PartitionKey key);
    Map<PartitionKey, SeasonConfig> findAll();
}
