package com.leaderboard.ranking.service;

import com.leaderboard.ranking.config.RankingProperties;
import com.leaderboard.ranking.engine.ActivityMask;
import com.leaderboard.ranking.engine.ActivityTransition;
import com.leaderboard.ranking.engine.AggregationStrategy;
import com.leaderboard.ranking.engine.GlobalRecord;
import com.leaderboard.ranking.engine.RecordHolder;
import com.leaderboard.ranking.engine.RecordObservation;
import com.leaderboard.ranking.engine.ScorePartition;
import com.leaderboard.ranking.engine.UpsertResult;
import com.leaderboard.ranking.event.ActiveCountChangedEvent;
import com.leaderboard.ranking.event.LeaderboardResetEvent;
import com.leaderboard.ranking.event.NewLeaderEvent;
import com.leaderboard.ranking.event.ScoreUpdatedEvent;
import com.leaderboard.ranking.exception.ArrayLengthMismatchException;
import com.leaderboard.ranking.exception.CooldownActiveException;
import com.leaderboard.ranking.exception.EmptyInputException;
import com.leaderboard.ranking.exception.InvalidCategoryException;
import com.leaderboard.ranking.exception.InvalidRequestException;
import com.leaderboard.ranking.exception.InvalidTimeframeException;
import com.leaderboard.ranking.exception.LeaderboardInactiveException;
import com.leaderboard.ranking.exception.NotAdmittedException;
import com.leaderboard.ranking.exception.ScoreOverflowException;
import com.leaderboard.ranking.exception.SeasonClosedException;
import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.PartitionKey;
import com.leaderboard.ranking.model.RankedEntry;
import com.leaderboard.ranking.model.RecordSummary;
import com.leaderboard.ranking.model.ScoreEntry;
import com.leaderboard.ranking.model.ScoreUpdate;
import com.leaderboard.ranking.model.SeasonConfig;
import com.leaderboard.ranking.model.Timeframe;
import com.leaderboard.ranking.model.TopEntities;
import com.leaderboard.ranking.repository.PartitionRepository;
import com.leaderboard.ranking.repository.SeasonConfigRepository;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongUnaryOperator;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Leaderboards keyed by (category, timeframe), the activity mask derived from them and the
 * best-score record across all of them.
 * <p>
 * Every call is one all-or-nothing unit: it runs under a single lock, validates before its first
 * mutation and publishes its events only after the lock is released.
 */
@Service
public class LeaderboardService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);

    static final String ACTIVITY_TRACKER = "leaderboards";

    private final PartitionRepository partitionRepository;
    private final SeasonConfigRepository seasonConfigRepository;
    private final RankingProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final ActivityMask activityMask;
    private final GlobalRecord<LeaderboardCategory> scoreRecord;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public LeaderboardService(
            PartitionRepository partitionRepository,
            SeasonConfigRepository seasonConfigRepository,
            RankingProperties properties,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.partitionRepository = partitionRepository;
        this.seasonConfigRepository = seasonConfigRepository;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.activityMask = new ActivityMask(
            PartitionKey.ACTIVITY_BITS, properties.getActivity().getInactivityThreshold(), clock);
        AggregationStrategy strategy = properties.getRecords().getStrategy();
        if (strategy != AggregationStrategy.PER_EVENT) {
            // one entity holds a score per timeframe, so category components would overwrite each other
            throw new IllegalStateException("Leaderboard records only support " + AggregationStrategy.PER_EVENT
                + ", got ranking.records.strategy=" + strategy);
        }
        this.scoreRecord = new GlobalRecord<>(strategy);
    }

    /**
     * Set the score of an entity in one leaderboard. A zero score removes the entity.
     *
     * @throws NotAdmittedException when the leaderboard is full and the score is too low to enter
     */
    public ScoreUpdate updateScore(String entity, LeaderboardCategory category, Timeframe timeframe, long newScore) {
        validateEntity(entity);
        PartitionKey key = toKey(category, timeframe);
        validateScore(newScore);
        return writeScore(entity, key, current -> newScore);
    }

    /**
     * Add {@code delta} to the entity's current score (zero when it holds no position).
     */
    public ScoreUpdate incrementScore(String entity, LeaderboardCategory category, Timeframe timeframe, long delta) {
        validateEntity(entity);
        PartitionKey key = toKey(category, timeframe);
        if (delta < 0) {
            throw new InvalidRequestException("Delta cannot be negative");
        }
        return writeScore(entity, key, current -> addScores(entity, current, delta));
    }

    /**
     * Apply several score writes to one leaderboard. Either every write is committed or none is.
     */
    public List<ScoreUpdate> batchUpdateScores(List<String> entities, LeaderboardCategory category,
                                               Timeframe timeframe, List<Long> scores) {
        if (entities == null || entities.isEmpty()) {
            throw new EmptyInputException("Entities cannot be empty");
        }
        if (scores == null || scores.size() != entities.size()) {
            throw new ArrayLengthMismatchException(String.format("Got %d entities but %d scores",
                entities.size(), scores == null ? 0 : scores.size()));
        }
        entities.forEach(this::validateEntity);
        for (Long score : scores) {
            if (score == null) {
                throw new InvalidRequestException("Score cannot be null");
            }
            validateScore(score);
        }
        PartitionKey key = toKey(category, timeframe);

        List<Object> events = new ArrayList<>();
        List<ScoreUpdate> updates = new ArrayList<>(entities.size());
        lock.lock();
        try {
            SeasonConfig config = configFor(key);
            ScorePartition working = partitionFor(key, config).copy();
            Instant now = clock.instant();

            List<AppliedScore> applied = new ArrayList<>(entities.size());
            for (int i = 0; i < entities.size(); i++) {
                String entity = entities.get(i);
                ensureWritable(key, config, working, entity, now);
                applied.add(applyToPartition(working, key, entity, scores.get(i), now));
            }

            partitionRepository.save(key, working);
            for (AppliedScore score : applied) {
                updates.add(commit(key, score, events));
            }
        } finally {
            lock.unlock();
        }
        publish(events);
        logger.info("Committed batch of {} score updates to leaderboard {}", updates.size(), key);
        return updates;
    }

    private ScoreUpdate writeScore(String entity, PartitionKey key, LongUnaryOperator nextScore) {
        List<Object> events = new ArrayList<>();
        ScoreUpdate update;
        lock.lock();
        try {
            SeasonConfig config = configFor(key);
            ScorePartition partition = partitionFor(key, config);
            Instant now = clock.instant();
            ensureWritable(key, config, partition, entity, now);

            long current = partition.getScore(entity).orElse(0L);
            AppliedScore applied = applyToPartition(partition, key, entity, nextScore.applyAsLong(current), now);
            update = commit(key, applied, events);
        } finally {
            lock.unlock();
        }
        publish(events);
        logger.info("Successfully updated score for entity {} in leaderboard {} - score: {}, rank: {}",
            entity, key, update.getScore(), update.getRank());
        return update;
    }

    private void ensureWritable(PartitionKey key, SeasonConfig config, ScorePartition partition,
                                String entity, Instant now) {
        if (!config.isActive()) {
            logger.warn("Rejected write for entity {}: leaderboard {} is inactive", entity, key);
            throw new LeaderboardInactiveException("Leaderboard " + key + " is not active");
        }
        if (!config.isWithinSeason(now)) {
            logger.warn("Rejected write for entity {}: leaderboard {} is outside its season", entity, key);
            throw new SeasonClosedException("Leaderboard " + key + " is outside its season window");
        }
        Duration cooldown = config.getUpdateCooldown();
        if (cooldown != null && !cooldown.isZero()) {
            Optional<Instant> last = partition.lastUpdated(entity);
            if (last.isPresent() && now.isBefore(last.get().plus(cooldown))) {
                throw new CooldownActiveException("Entity " + entity + " updated " + key + " less than "
                    + cooldown.getSeconds() + "s ago");
            }
        }
    }

    // Touches only the partition; throws before any change when the entity is not admitted.
    private AppliedScore applyToPartition(ScorePartition partition, PartitionKey key, String entity,
                                          long newScore, Instant now) {
        String previousLeader = partition.leader().orElse(null);
        UpsertResult result = partition.upsert(entity, newScore);
        if (result.isNotAdmitted()) {
            logger.warn("Score {} of entity {} is too low for full leaderboard {}", newScore, entity, key);
            throw new NotAdmittedException(String.format(
                "Score %d of %s does not beat the lowest entry of full leaderboard %s", newScore, entity, key));
        }
        partition.markUpdated(entity, now);
        boolean tookLead = result.isAdmitted() && result.getRank() == 1 && !entity.equals(previousLeader);
        return new AppliedScore(result, tookLead);
    }

    private ScoreUpdate commit(PartitionKey key, AppliedScore applied, List<Object> events) {
        UpsertResult result = applied.getResult();
        String entity = result.getEntity();
        int bit = key.activityBit();

        recordActivity(activityMask.setCategoryActive(entity, bit, result.isAdmitted()), events);
        result.evictedEntity().ifPresent(evicted ->
            recordActivity(activityMask.setCategoryActive(evicted, bit, false), events));

        RecordObservation<LeaderboardCategory> observation =
            scoreRecord.observe(entity, key.getCategory(), result.getScore());

        events.add(new ScoreUpdatedEvent(entity, key.getCategory(), key.getTimeframe(),
            result.getScore(), result.rankPosition()));
        if (applied.isTookLead()) {
            events.add(new NewLeaderEvent(NewLeaderEvent.Scope.PARTITION, entity,
                key.getCategory().name(), key.getTimeframe().name(), result.getScore()));
        }
        if (observation.isNewLeader()) {
            events.add(new NewLeaderEvent(NewLeaderEvent.Scope.GLOBAL_RECORD, entity,
                null, null, observation.getAggregate()));
        }
        if (observation.isNewCategoryLeader()) {
            events.add(new NewLeaderEvent(NewLeaderEvent.Scope.CATEGORY_RECORD, entity,
                key.getCategory().name(), null, observation.getValue()));
        }

        return ScoreUpdate.builder()
            .entity(entity)
            .category(key.getCategory())
            .timeframe(key.getTimeframe())
            .score(result.getScore())
            .rank(result.rankPosition())
            .evicted(result.getEvicted())
            .build();
    }

    private void recordActivity(ActivityTransition transition, List<Object> events) {
        if (transition.counterChanged()) {
            events.add(new ActiveCountChangedEvent(ACTIVITY_TRACKER, transition.getTotalActive()));
        }
    }

    /**
     * Empty one leaderboard. Every former entrant loses the activity bit of this leaderboard; its
     * config and the global record are left as they are.
     */
    public void resetLeaderboard(LeaderboardCategory category, Timeframe timeframe) {
        PartitionKey key = toKey(category, timeframe);
        List<Object> events = new ArrayList<>();
        int cleared = 0;
        lock.lock();
        try {
            Optional<ScorePartition> found = partitionRepository.findByKey(key);
            if (found.isPresent()) {
                ScorePartition partition = found.get();
                cleared = partition.size();
                for (ScoreEntry entry : partition.entries()) {
                    recordActivity(activityMask.setCategoryActive(entry.getEntity(), key.activityBit(), false), events);
                }
                partition.clear();
            }
        } finally {
            lock.unlock();
        }
        events.add(new LeaderboardResetEvent(category, timeframe, cleared));
        publish(events);
        logger.info("Reset leaderboard {} - cleared {} entries", key, cleared);
    }

    /**
     * Replace the config of one leaderboard. A smaller capacity drops the lowest entries.
     */
    public SeasonConfig setConfig(LeaderboardCategory category, Timeframe timeframe, SeasonConfig config) {
        PartitionKey key = toKey(category, timeframe);
        SeasonConfig normalized = validateConfig(config);

        List<Object> events = new ArrayList<>();
        lock.lock();
        try {
            seasonConfigRepository.save(key, normalized);
            Optional<ScorePartition> partition = partitionRepository.findByKey(key);
            if (partition.isPresent()) {
                List<String> dropped = partition.get().resize(normalized.getMaxEntries());
                for (String entity : dropped) {
                    recordActivity(activityMask.setCategoryActive(entity, key.activityBit(), false), events);
                }
                if (!dropped.isEmpty()) {
                    logger.info("Capacity of leaderboard {} shrank to {} - dropped {} entries",
                        key, normalized.getMaxEntries(), dropped.size());
                }
            }
        } finally {
            lock.unlock();
        }
        publish(events);
        logger.info("Updated config of leaderboard {} - active: {}, maxEntries: {}, cooldown: {}",
            key, normalized.isActive(), normalized.getMaxEntries(), normalized.getUpdateCooldown());
        return normalized;
    }

    public SeasonConfig getConfig(LeaderboardCategory category, Timeframe timeframe) {
        PartitionKey key = toKey(category, timeframe);
        return read(() -> configFor(key));
    }

    /**
     * Open a new season on the season timeframe of {@code category}, starting now. Entries are kept;
     * clearing them is a separate reset.
     */
    public SeasonConfig startNewSeason(LeaderboardCategory category, Duration duration) {
        PartitionKey key = toKey(category, properties.getSeasonTimeframe());
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidRequestException("Season duration must be positive");
        }

        SeasonConfig season;
        lock.lock();
        try {
            season = configFor(key).toBuilder()
                .active(true)
                .seasonStartTime(clock.instant())
                .seasonDuration(duration)
                .build();
            seasonConfigRepository.save(key, season);
        } finally {
            lock.unlock();
        }
        logger.info("Started new season on leaderboard {} - start: {}, duration: {}",
            key, season.getSeasonStartTime(), duration);
        return season;
    }

    public Timeframe getSeasonTimeframe() {
        return properties.getSeasonTimeframe();
    }

    /**
     * Deactivate the listed entities that have been idle past the inactivity threshold.
     *
     * @return the entities deactivated by this call
     */
    public List<String> cleanupInactive(List<String> entities) {
        if (entities == null || entities.isEmpty()) {
            throw new EmptyInputException("Entities cannot be empty");
        }
        List<String> deactivated;
        long total;
        lock.lock();
        try {
            deactivated = activityMask.cleanup(entities);
            total = activityMask.totalActive();
        } finally {
            lock.unlock();
        }
        if (!deactivated.isEmpty()) {
            eventPublisher.publishEvent(new ActiveCountChangedEvent(ACTIVITY_TRACKER, total));
        }
        logger.info("Cleanup checked {} entities - deactivated {}", entities.size(), deactivated.size());
        return deactivated;
    }

    /**
     * Score of the entity in one leaderboard, zero when it holds no position.
     */
    public long getScore(String entity, LeaderboardCategory category, Timeframe timeframe) {
        PartitionKey key = toKey(category, timeframe);
        return read(() -> partitionRepository.findByKey(key)
            .map(partition -> partition.getScore(entity).orElse(0L))
            .orElse(0L));
    }

    public OptionalInt getRank(String entity, LeaderboardCategory category, Timeframe timeframe) {
        PartitionKey key = toKey(category, timeframe);
        return read(() -> partitionRepository.findByKey(key)
            .map(partition -> partition.getRank(entity))
            .orElse(OptionalInt.empty()));
    }

    public Optional<RankedEntry> getUserScore(String entity, LeaderboardCategory category, Timeframe timeframe) {
        PartitionKey key = toKey(category, timeframe);
        return read(() -> partitionRepository.findByKey(key).flatMap(partition -> {
            OptionalInt rank = partition.getRank(entity);
            if (rank.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(RankedEntry.builder()
                .entity(entity)
                .score(partition.getScore(entity).orElse(0L))
                .rank(rank.getAsInt())
                .build());
        }));
    }

    public List<RankedEntry> getLeaderboard(LeaderboardCategory category, Timeframe timeframe, int limit) {
        PartitionKey key = toKey(category, timeframe);
        validateLimit(limit);
        List<RankedEntry> entries = page(key, 0, limit);
        logger.debug("Retrieved {} entries from leaderboard {} (limit {})", entries.size(), key, limit);
        return entries;
    }

    /**
     * A window of the leaderboard. Out-of-range offsets return an empty list.
     */
    public List<RankedEntry> getLeaderboardPage(LeaderboardCategory category, Timeframe timeframe,
                                                int offset, int count) {
        return page(toKey(category, timeframe), offset, count);
    }

    public TopEntities getTopEntities(LeaderboardCategory category, Timeframe timeframe, int limit) {
        List<RankedEntry> entries = getLeaderboard(category, timeframe, limit);
        return new TopEntities(
            entries.stream().map(RankedEntry::getEntity).collect(Collectors.toList()),
            entries.stream().map(RankedEntry::getScore).collect(Collectors.toList()));
    }

    public int getTotalEntries(LeaderboardCategory category, Timeframe timeframe) {
        PartitionKey key = toKey(category, timeframe);
        return read(() -> partitionRepository.findByKey(key).map(ScorePartition::size).orElse(0));
    }

    public boolean isActive(String entity) {
        return read(() -> activityMask.isActive(entity));
    }

    /**
     * Activity mask of the entity; bit {@link PartitionKey#activityBit()} is set while it holds a position
     * in that leaderboard.
     */
    public long activeCategories(String entity) {
        return read(() -> activityMask.activeCategories(entity));
    }

    public long totalActive() {
        return read(activityMask::totalActive);
    }

    public RecordSummary getGlobalRecord() {
        return read(() -> {
            Map<String, Long> bestByCategory = new LinkedHashMap<>();
            Map<String, String> holderByCategory = new LinkedHashMap<>();
            for (LeaderboardCategory category : LeaderboardCategory.values()) {
                RecordHolder holder = scoreRecord.getCategoryBest(category);
                if (holder.getHolder() != null) {
                    bestByCategory.put(category.name(), holder.getValue());
                    holderByCategory.put(category.name(), holder.getHolder());
                }
            }
            RecordHolder best = scoreRecord.getBest();
            return RecordSummary.builder()
                .bestValue(best.getValue())
                .holder(best.getHolder())
                .categoryBest(bestByCategory)
                .categoryHolder(holderByCategory)
                .build();
        });
    }

    private List<RankedEntry> page(PartitionKey key, int offset, int count) {
        return read(() -> partitionRepository.findByKey(key)
            .map(partition -> partition.getPage(offset, count))
            .orElse(Collections.emptyList()));
    }

    private SeasonConfig configFor(PartitionKey key) {
        return seasonConfigRepository.findByKey(key).orElseGet(this::defaultConfig);
    }

    private SeasonConfig defaultConfig() {
        RankingProperties.Defaults defaults = properties.getDefaults();
        return SeasonConfig.builder()
            .active(defaults.isActive())
            .maxEntries(defaults.getMaxEntries())
            .updateCooldown(defaults.getUpdateCooldown())
            .build();
    }

    private ScorePartition partitionFor(PartitionKey key, SeasonConfig config) {
        return partitionRepository.findByKey(key)
            .orElseGet(() -> partitionRepository.save(key, new ScorePartition(key.storageKey(), config.getMaxEntries())));
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    private void publish(List<Object> events) {
        events.forEach(eventPublisher::publishEvent);
    }

    private static SeasonConfig validateConfig(SeasonConfig config) {
        if (config == null) {
            throw new InvalidRequestException("Config cannot be null");
        }
        if (config.getMaxEntries() < 1) {
            throw new InvalidRequestException("maxEntries must be at least 1");
        }
        Duration cooldown = config.getUpdateCooldown() == null ? Duration.ZERO : config.getUpdateCooldown();
        Duration duration = config.getSeasonDuration() == null ? Duration.ZERO : config.getSeasonDuration();
        if (cooldown.isNegative()) {
            throw new InvalidRequestException("updateCooldown cannot be negative");
        }
        if (duration.isNegative()) {
            throw new InvalidRequestException("seasonDuration cannot be negative");
        }
        return config.toBuilder().updateCooldown(cooldown).seasonDuration(duration).build();
    }

    private static PartitionKey toKey(LeaderboardCategory category, Timeframe timeframe) {
        if (category == null) {
            throw new InvalidCategoryException("Category cannot be null");
        }
        if (timeframe == null) {
            throw new InvalidTimeframeException("Timeframe cannot be null");
        }
        return PartitionKey.of(category, timeframe);
    }

    private void validateEntity(String entity) {
        if (entity == null || entity.trim().isEmpty()) {
            throw new InvalidRequestException("Entity cannot be null or empty");
        }
    }

    private static void validateScore(long score) {
        if (score < 0) {
            throw new InvalidRequestException("Score cannot be negative");
        }
    }

    private static void validateLimit(int limit) {
        if (limit <= 0) {
            throw new InvalidRequestException("Limit must be greater than 0");
        }
    }

    private static long addScores(String entity, long current, long delta) {
        try {
            return Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            throw new ScoreOverflowException("Score of " + entity + " would overflow: " + current + " + " + delta);
        }
    }

    @Value
    private static class AppliedScore {
        UpsertResult result;
        boolean tookLead;
    }
}
