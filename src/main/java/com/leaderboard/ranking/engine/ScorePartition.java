package com.leaderboard.ranking.engine;

import com.leaderboard.ranking.model.RankedEntry;
import com.leaderboard.ranking.model.ScoreEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.function.LongPredicate;

/**
 * Bounded collection of entities ordered by descending score.
 * <p>
 * Entries live in a flat list kept sorted at all times; an entity-to-position index gives
 * constant time rank lookups. Insertion points are located by binary search and only the
 * entries between the old and the new position are shifted and re-indexed.
 * <p>
 * Equal scores never swap: an entry moves up only past strictly lower neighbours and down
 * only past strictly higher ones, so ties keep their insertion order.
 * <p>
 * Not thread-safe. Callers serialize access.
 */
public class ScorePartition {

    private final String name;
    private int capacity;
    private final List<ScoreEntry> entries;
    private final Map<String, Integer> index;
    private final Map<String, Instant> lastUpdated;

    public ScorePartition(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, got " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.entries = new ArrayList<>(Math.min(capacity, 64));
        this.index = new HashMap<>();
        this.lastUpdated = new HashMap<>();
    }

    private ScorePartition(ScorePartition source) {
        this.name = source.name;
        this.capacity = source.capacity;
        this.entries = new ArrayList<>(source.entries);
        this.index = new HashMap<>(source.index);
        this.lastUpdated = new HashMap<>(source.lastUpdated);
    }

    /**
     * Insert, reposition or remove {@code entity} so that it holds {@code newScore}.
     * A zero score removes a present entity. When the partition is full an absent entity is
     * admitted only with a score strictly above the lowest held score, evicting that entry;
     * otherwise the partition is left untouched and {@link UpsertResult.Status#NOT_ADMITTED}
     * is returned.
     */
    public UpsertResult upsert(String entity, long newScore) {
        requireEntity(entity);
        if (newScore < 0) {
            throw new IllegalArgumentException("Score cannot be negative: " + newScore);
        }

        Integer current = index.get(entity);
        if (current != null) {
            if (newScore == 0) {
                removeAt(current);
                return UpsertResult.removed(entity);
            }
            int position = reposition(current, new ScoreEntry(entity, newScore));
            return UpsertResult.admitted(entity, newScore, position + 1, null);
        }

        if (newScore == 0) {
            return UpsertResult.unranked(entity);
        }

        if (entries.size() < capacity) {
            int position = insert(new ScoreEntry(entity, newScore));
            return UpsertResult.admitted(entity, newScore, position + 1, null);
        }

        ScoreEntry lowest = entries.get(entries.size() - 1);
        if (newScore <= lowest.getScore()) {
            return UpsertResult.notAdmitted(entity, newScore);
        }
        removeAt(entries.size() - 1);
        int position = insert(new ScoreEntry(entity, newScore));
        return UpsertResult.admitted(entity, newScore, position + 1, lowest.getEntity());
    }

    /**
     * Delete the entry of {@code entity}. Absent entities are ignored.
     *
     * @return true when an entry was removed
     */
    public boolean remove(String entity) {
        Integer position = index.get(entity);
        if (position == null) {
            return false;
        }
        removeAt(position);
        return true;
    }

    public OptionalInt getRank(String entity) {
        Integer position = index.get(entity);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position + 1);
    }

    public OptionalLong getScore(String entity) {
        Integer position = index.get(entity);
        return position == null ? OptionalLong.empty() : OptionalLong.of(entries.get(position).getScore());
    }

    public boolean contains(String entity) {
        return index.containsKey(entity);
    }

    public Optional<String> leader() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0).getEntity());
    }

    /**
     * Up to {@code count} ranked entries starting at the zero-based {@code offset}.
     * Offsets past the end and non-positive counts yield an empty page.
     */
    public List<RankedEntry> getPage(int offset, int count) {
        if (offset < 0 || count <= 0 || offset >= entries.size()) {
            return Collections.emptyList();
        }
        int end = (int) Math.min((long) offset + count, entries.size());
        List<RankedEntry> page = new ArrayList<>(end - offset);
        for (int i = offset; i < end; i++) {
            ScoreEntry entry = entries.get(i);
            page.add(RankedEntry.builder()
                .entity(entry.getEntity())
                .score(entry.getScore())
                .rank(i + 1)
                .build());
        }
        return page;
    }

    public Optional<Instant> lastUpdated(String entity) {
        return Optional.ofNullable(lastUpdated.get(entity));
    }

    /**
     * Stamp the time of an accepted write. Stamps of entities not held are ignored.
     */
    public void markUpdated(String entity, Instant at) {
        if (index.containsKey(entity)) {
            lastUpdated.put(entity, at);
        }
    }

    public void clear() {
        entries.clear();
        index.clear();
        lastUpdated.clear();
    }

    /**
     * Change the capacity, dropping the lowest entries that no longer fit.
     *
     * @return the entities dropped, lowest first
     */
    public List<String> resize(int newCapacity) {
        if (newCapacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, got " + newCapacity);
        }
        List<String> dropped = new ArrayList<>();
        while (entries.size() > newCapacity) {
            ScoreEntry lowest = entries.get(entries.size() - 1);
            removeAt(entries.size() - 1);
            dropped.add(lowest.getEntity());
        }
        this.capacity = newCapacity;
        return dropped;
    }

    public ScorePartition copy() {
        return new ScorePartition(this);
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<ScoreEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    private int reposition(int current, ScoreEntry updated) {
        long oldScore = entries.get(current).getScore();
        long newScore = updated.getScore();
        int target = current;
        if (newScore > oldScore) {
            target = firstMatching(0, current, score -> score < newScore);
        } else if (newScore < oldScore) {
            target = firstMatching(current + 1, entries.size(), score -> score <= newScore) - 1;
        }

        if (target == current) {
            entries.set(current, updated);
            return current;
        }
        entries.remove(current);
        entries.add(target, updated);
        reindex(Math.min(current, target), Math.max(current, target));
        return target;
    }

    private int insert(ScoreEntry entry) {
        long score = entry.getScore();
        int position = firstMatching(0, entries.size(), held -> held < score);
        entries.add(position, entry);
        reindex(position, entries.size() - 1);
        return position;
    }

    private void removeAt(int position) {
        ScoreEntry removed = entries.remove(position);
        index.remove(removed.getEntity());
        lastUpdated.remove(removed.getEntity());
        reindex(position, entries.size() - 1);
    }

    private void reindex(int from, int to) {
        for (int i = from; i <= to; i++) {
            index.put(entries.get(i).getEntity(), i);
        }
    }

    // Scores are non-increasing, so the predicate flips from false to true at most once in [from, to).
    private int firstMatching(int from, int to, LongPredicate predicate) {
        int low = from;
        int high = to;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (predicate.test(entries.get(mid).getScore())) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    private static void requireEntity(String entity) {
        if (entity == null || entity.trim().isEmpty()) {
            throw new IllegalArgumentException("Entity cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return "ScorePartition{" + name + ", size=" + entries.size() + "/" + capacity + "}";
    }
}
