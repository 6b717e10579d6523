package com.leaderboard.ranking.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.leaderboard.ranking.exception.LeaderboardException;
import com.leaderboard.ranking.model.PartitionKey;
import com.leaderboard.ranking.model.SeasonConfig;
import com.leaderboard.ranking.repository.SeasonConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Season configs kept in one JSON document, {@code season-configs.json}, under the storage
 * directory. Reads are served from memory; every save rewrites the file.
 */
@Repository
public class JsonSeasonConfigRepository implements SeasonConfigRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonSeasonConfigRepository.class);
    private static final String CONFIG_FILE = "season-configs.json";
    private static final TypeReference<Map<String, SeasonConfig>> CONFIG_MAP = new TypeReference<>() { };

    private final String dataDirectory;
    private final ObjectMapper objectMapper;
    private final Map<PartitionKey, SeasonConfig> cache = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonSeasonConfigRepository(@Value("${ranking.storage.directory:./data}") String dataDirectory) {
        this.dataDirectory = dataDirectory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        initializeDirectory();
        loadConfigs();
    }

    private void initializeDirectory() {
        try {
            Path path = Paths.get(dataDirectory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw new LeaderboardException("Failed to create data directory: " + dataDirectory, "STORAGE_ERROR", e);
        }
    }

    private void loadConfigs() {
        File file = configFile();
        if (!file.exists()) {
            return;
        }
        try {
            Map<String, SeasonConfig> stored = objectMapper.readValue(file, CONFIG_MAP);
            stored.forEach((storageKey, config) -> cache.put(PartitionKey.fromStorageKey(storageKey), config));
            logger.info("Loaded {} season configs from {}", cache.size(), file);
        } catch (IOException e) {
            throw new LeaderboardException("Failed to read season configs from " + file, "STORAGE_ERROR", e);
        }
    }

    @Override
    public SeasonConfig save(PartitionKey key, SeasonConfig config) {
        if (key == null) {
            throw new IllegalArgumentException("Partition key cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Season config cannot be null");
        }

        writeLock.lock();
        try {
            Map<PartitionKey, SeasonConfig> updated = new LinkedHashMap<>(cache);
            updated.put(key, config);
            writeFile(updated);
            cache.put(key, config);
            return config;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<SeasonConfig> findByKey(PartitionKey key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(key));
    }

    @Override
    public Map<PartitionKey, SeasonConfig> findAll() {
        return new LinkedHashMap<>(cache);
    }

    private void writeFile(Map<PartitionKey, SeasonConfig> configs) {
        Map<String, SeasonConfig> document = new TreeMap<>();
        configs.forEach((key, config) -> document.put(key.storageKey(), config));
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(configFile(), document);
        } catch (IOException e) {
            throw new LeaderboardException("Failed to save season configs to file", "STORAGE_ERROR", e);
        }
    }

    private File configFile() {
        return new File(dataDirectory, CONFIG_FILE);
    }
}
