package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.PartitionKey;
import com.leaderboard.ranking.model.SeasonConfig;
import com.leaderboard.ranking.model.Timeframe;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonSeasonConfigRepositoryTest {

    @TempDir
    Path dataDirectory;

    @Test
    void testSave_PersistsAcrossInstances() {
        // Arrange
        PartitionKey key = PartitionKey.of(LeaderboardCategory.XP_TOTAL, Timeframe.DAILY);
        SeasonConfig config = SeasonConfig.builder()
            .active(true)
            .maxEntries(50)
            .updateCooldown(Duration.ofMinutes(10))
            .seasonStartTime(Instant.parse("2024-06-01T00:00:00Z"))
            .seasonDuration(Duration.ofDays(30))
            .build();

        // Act
        new JsonSeasonConfigRepository(dataDirectory.toString()).save(key, config);
        JsonSeasonConfigRepository reloaded = new JsonSeasonConfigRepository(dataDirectory.toString());

        // Assert
        assertTrue(Files.exists(dataDirectory.resolve("season-configs.json")));
        assertEquals(Optional.of(config), reloaded.findByKey(key));
    }

    @Test
    void testSave_OverwritesExistingKey() {
        JsonSeasonConfigRepository repository = new JsonSeasonConfigRepository(dataDirectory.toString());
        PartitionKey daily = PartitionKey.of(LeaderboardCategory.REFERRAL_COUNT, Timeframe.DAILY);
        PartitionKey weekly = PartitionKey.of(LeaderboardCategory.REFERRAL_COUNT, Timeframe.WEEKLY);

        repository.save(daily, SeasonConfig.builder().active(true).maxEntries(10).build());
        repository.save(weekly, SeasonConfig.builder().active(true).maxEntries(20).build());
        repository.save(daily, SeasonConfig.builder().active(false).maxEntries(5).build());

        Map<PartitionKey, SeasonConfig> all = new JsonSeasonConfigRepository(dataDirectory.toString()).findAll();
        assertEquals(2, all.size());
        assertFalse(all.get(daily).isActive());
        assertEquals(5, all.get(daily).getMaxEntries());
        assertEquals(20, all.get(weekly).getMaxEntries());
    }

    @Test
    void testFindByKey_Missing() {
        JsonSeasonConfigRepository repository = new JsonSeasonConfigRepository(dataDirectory.resolve("nested").toString());

        assertFalse(repository.findByKey(PartitionKey.of(LeaderboardCategory.XP_TOTAL, Timeframe.ALL_TIME)).isPresent());
        assertFalse(repository.findByKey(null).isPresent());
        assertTrue(Files.isDirectory(dataDirectory.resolve("nested")));
    }

    @Test
    void testSave_InvalidInputs() {
        JsonSeasonConfigRepository repository = new JsonSeasonConfigRepository(dataDirectory.toString());

        assertThrows(IllegalArgumentException.class, () -> repository.save(null, new SeasonConfig()));
        assertThrows(IllegalArgumentException.class,
            () -> repository.save(PartitionKey.of(LeaderboardCategory.XP_TOTAL, Timeframe.DAILY), null));
    }
}
