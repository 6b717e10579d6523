package com.leaderboard.ranking.engine;

import com.leaderboard.ranking.model.RankedEntry;
import com.leaderboard.ranking.model.ScoreEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ScorePartitionTest {

    @Test
    void testUpsert_OrdersByDescendingScore() {
        ScorePartition partition = new ScorePartition("XP_TOTAL:ALL_TIME", 10);

        partition.upsert("A", 100);
        partition.upsert("B", 150);
        partition.upsert("C", 50);

        assertThat(entities(partition)).containsExactly("B", "A", "C");
        assertEquals(OptionalInt.of(1), partition.getRank("B"));
        assertEquals(OptionalInt.of(2), partition.getRank("A"));
        assertEquals(OptionalInt.of(3), partition.getRank("C"));
    }

    @Test
    void testUpsert_RepositionsExistingEntity() {
        ScorePartition partition = new ScorePartition("XP_TOTAL:ALL_TIME", 10);
        partition.upsert("A", 100);
        partition.upsert("B", 150);
        partition.upsert("C", 50);

        UpsertResult result = partition.upsert("C", 120);

        assertTrue(result.isAdmitted());
        assertEquals(2, result.getRank());
        assertThat(entities(partition)).containsExactly("B", "C", "A");
        assertEquals(3, partition.size());
    }

    @Test
    void testUpsert_FullPartitionEvictsLowest() {
        // Arrange
        ScorePartition partition = new ScorePartition("board", 10);
        for (int score = 100; score >= 10; score -= 10) {
            partition.upsert("e" + score, score);
        }

        // Act
        UpsertResult result = partition.upsert("newcomer", 15);

        // Assert
        assertTrue(result.isAdmitted());
        assertEquals("e10", result.getEvicted());
        assertEquals(10, partition.size());
        assertFalse(partition.contains("e10"));
        assertEquals(OptionalInt.of(10), partition.getRank("newcomer"));
        assertEquals(OptionalInt.of(9), partition.getRank("e20"));
    }

    @Test
    void testUpsert_FullPartitionRejectsLowScore() {
        ScorePartition partition = new ScorePartition("board", 10);
        for (int score = 100; score >= 10; score -= 10) {
            partition.upsert("e" + score, score);
        }
        List<ScoreEntry> before = List.copyOf(partition.entries());

        UpsertResult result = partition.upsert("latecomer", 5);

        assertTrue(result.isNotAdmitted());
        assertEquals(UpsertResult.Status.NOT_ADMITTED, result.getStatus());
        assertFalse(result.rankPosition().isPresent());
        assertEquals(before, partition.entries());
    }

    @Test
    void testUpsert_ScoreEqualToLowestIsNotAdmitted() {
        ScorePartition partition = new ScorePartition("board", 2);
        partition.upsert("A", 20);
        partition.upsert("B", 10);

        UpsertResult result = partition.upsert("C", 10);

        assertTrue(result.isNotAdmitted());
        assertThat(entities(partition)).containsExactly("A", "B");
    }

    @Test
    void testUpsert_TiesKeepInsertionOrder() {
        ScorePartition partition = new ScorePartition("board", 10);
        partition.upsert("first", 50);
        partition.upsert("second", 50);
        partition.upsert("third", 50);

        assertThat(entities(partition)).containsExactly("first", "second", "third");

        // moving up stops behind entries with the same score
        partition.upsert("low", 10);
        partition.upsert("low", 50);
        assertThat(entities(partition)).containsExactly("first", "second", "third", "low");
    }

    @Test
    void testUpsert_SameScoreKeepsPosition() {
        ScorePartition partition = new ScorePartition("board", 10);
        partition.upsert("A", 30);
        partition.upsert("B", 30);

        UpsertResult result = partition.upsert("A", 30);

        assertEquals(1, result.getRank());
        assertThat(entities(partition)).containsExactly("A", "B");
    }

    @Test
    void testUpsert_ZeroScoreRemovesEntry() {
        ScorePartition partition = new ScorePartition("board", 10);
        partition.upsert("A", 30);
        partition.upsert("B", 20);

        UpsertResult removed = partition.upsert("A", 0);
        UpsertResult unranked = partition.upsert("ghost", 0);

        assertEquals(UpsertResult.Status.REMOVED, removed.getStatus());
        assertEquals(UpsertResult.Status.UNRANKED, unranked.getStatus());
        assertFalse(partition.contains("A"));
        assertFalse(partition.contains("ghost"));
        assertEquals(OptionalInt.of(1), partition.getRank("B"));
    }

    @Test
    void testUpsert_InvalidInputs() {
        ScorePartition partition = new ScorePartition("board", 10);

        assertThrows(IllegalArgumentException.class, () -> partition.upsert(null, 10));
        assertThrows(IllegalArgumentException.class, () -> partition.upsert(" ", 10));
        assertThrows(IllegalArgumentException.class, () -> partition.upsert("A", -1));
        assertThrows(IllegalArgumentException.class, () -> new ScorePartition("board", 0));
    }

    @Test
    void testIndexMatchesPositionsAfterMixedWrites() {
        ScorePartition partition = new ScorePartition("board", 5);
        long[] scores = {40, 70, 10, 90, 55, 30, 80, 20, 65, 5};
        for (int i = 0; i < scores.length; i++) {
            partition.upsert("e" + (i % 7), scores[i]);
        }
        partition.upsert("e3", 0);
        partition.upsert("e1", 100);

        List<ScoreEntry> entries = partition.entries();
        assertTrue(entries.size() <= 5);
        for (int i = 0; i < entries.size(); i++) {
            assertEquals(OptionalInt.of(i + 1), partition.getRank(entries.get(i).getEntity()));
            if (i > 0) {
                assertTrue(entries.get(i - 1).getScore() >= entries.get(i).getScore());
            }
        }
        assertThat(entries.stream().map(ScoreEntry::getEntity).distinct().count()).isEqualTo(entries.size());
    }

    @Test
    void testGetPage() {
        ScorePartition partition = new ScorePartition("board", 10);
        partition.upsert("A", 30);
        partition.upsert("B", 20);
        partition.upsert("C", 10);

        List<RankedEntry> page = partition.getPage(1, 5);

        assertEquals(2, page.size());
        assertEquals("B", page.get(0).getEntity());
        assertEquals(2, page.get(0).getRank());
        assertEquals(10L, page.get(1).getScore());
        assertTrue(partition.getPage(3, 5).isEmpty());
        assertTrue(partition.getPage(-1, 5).isEmpty());
        assertTrue(partition.getPage(0, 0).isEmpty());
        assertEquals(3, partition.getPage(0, Integer.MAX_VALUE).size());
    }

    @Test
    void testResize_DropsLowestEntries() {
        ScorePartition partition = new ScorePartition("board", 5);
        partition.upsert("A", 50);
        partition.upsert("B", 40);
        partition.upsert("C", 30);
        partition.upsert("D", 20);

        List<String> dropped = partition.resize(2);

        assertThat(dropped).containsExactly("D", "C");
        assertThat(entities(partition)).containsExactly("A", "B");
        assertEquals(2, partition.getCapacity());
        assertTrue(partition.upsert("E", 10).isNotAdmitted());
    }

    @Test
    void testCopy_IsIndependent() {
        ScorePartition partition = new ScorePartition("board", 3);
        partition.upsert("A", 30);
        partition.markUpdated("A", Instant.parse("2024-01-01T00:00:00Z"));

        ScorePartition copy = partition.copy();
        copy.upsert("B", 40);
        copy.upsert("A", 0);

        assertThat(entities(partition)).containsExactly("A");
        assertTrue(partition.lastUpdated("A").isPresent());
        assertThat(entities(copy)).containsExactly("B");
        assertFalse(copy.lastUpdated("A").isPresent());
    }

    @Test
    void testMarkUpdated_IgnoresAbsentEntity() {
        ScorePartition partition = new ScorePartition("board", 3);

        partition.markUpdated("ghost", Instant.now());

        assertFalse(partition.lastUpdated("ghost").isPresent());
    }

    @Test
    void testClearAndLeader() {
        ScorePartition partition = new ScorePartition("board", 3);
        partition.upsert("A", 10);
        partition.upsert("B", 20);
        assertEquals("B", partition.leader().orElse(null));

        partition.clear();

        assertTrue(partition.isEmpty());
        assertFalse(partition.leader().isPresent());
        assertFalse(partition.getScore("A").isPresent());
        assertFalse(partition.remove("A"));
    }

    private static List<String> entities(ScorePartition partition) {
        return partition.entries().stream().map(ScoreEntry::getEntity).collect(Collectors.toList());
    }
}
