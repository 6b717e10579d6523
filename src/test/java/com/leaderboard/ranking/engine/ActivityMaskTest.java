package com.leaderboard.ranking.engine;

import com.leaderboard.ranking.model.StreakType;
import com.leaderboard.ranking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActivityMaskTest {

    private MutableClock clock;
    private ActivityMask mask;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        mask = new ActivityMask(StreakType.values().length, Duration.ofDays(7), clock);
    }

    @Test
    void testTwoBitsCountOneEntity() {
        mask.setCategoryActive("U", StreakType.DAILY_LOGIN.bit(), true);
        ActivityTransition transition = mask.setCategoryActive("U", StreakType.QUEST_COMPLETION.bit(), true);

        assertEquals(1, mask.totalActive());
        assertEquals(0, transition.getCounterDelta());
        assertEquals(StreakType.DAILY_LOGIN.mask() | StreakType.QUEST_COMPLETION.mask(), mask.activeCategories("U"));
    }

    @Test
    void testCounterDropsOnlyWhenLastBitClears() {
        mask.setCategoryActive("U", StreakType.DAILY_LOGIN.bit(), true);
        mask.setCategoryActive("U", StreakType.QUEST_COMPLETION.bit(), true);

        mask.setCategoryActive("U", StreakType.DAILY_LOGIN.bit(), false);
        assertEquals(1, mask.totalActive());
        assertTrue(mask.isActive("U"));

        ActivityTransition transition = mask.setCategoryActive("U", StreakType.QUEST_COMPLETION.bit(), false);
        assertEquals(0, mask.totalActive());
        assertEquals(-1, transition.getCounterDelta());
        assertFalse(mask.isActive("U"));
    }

    @Test
    void testRepeatedWritesDoNotMoveCounter() {
        mask.setCategoryActive("U", 0, true);
        ActivityTransition again = mask.setCategoryActive("U", 0, true);
        ActivityTransition clearAbsent = mask.setCategoryActive("nobody", 0, false);

        assertFalse(again.maskChanged());
        assertFalse(again.counterChanged());
        assertFalse(clearAbsent.counterChanged());
        assertEquals(1, mask.totalActive());
        assertFalse(mask.lastActivity("nobody").isPresent());
    }

    @Test
    void testCleanup_DeactivatesOnlyIdleEntities() {
        // Arrange
        mask.setCategoryActive("idle", 0, true);
        mask.setCategoryActive("idle", 2, true);
        clock.advance(Duration.ofDays(5));
        mask.setCategoryActive("recent", 1, true);
        clock.advance(Duration.ofDays(3));

        // Act
        List<String> deactivated = mask.cleanup(Arrays.asList("idle", "recent", "unknown"));

        // Assert
        assertEquals(List.of("idle"), deactivated);
        assertEquals(0L, mask.activeCategories("idle"));
        assertTrue(mask.isActive("recent"));
        assertEquals(1, mask.totalActive());
    }

    @Test
    void testCleanup_IsIdempotent() {
        mask.setCategoryActive("U", 0, true);
        clock.advance(Duration.ofDays(8));

        assertEquals(List.of("U"), mask.cleanup(List.of("U")));
        assertTrue(mask.cleanup(List.of("U")).isEmpty());
        assertEquals(0, mask.totalActive());
    }

    @Test
    void testActiveWriteRefreshesTimestamp() {
        mask.setCategoryActive("U", 0, true);
        clock.advance(Duration.ofDays(6));
        mask.setCategoryActive("U", 0, true);
        clock.advance(Duration.ofDays(6));

        assertTrue(mask.cleanup(List.of("U")).isEmpty());
        assertEquals(clock.instant().minus(Duration.ofDays(6)), mask.lastActivity("U").orElse(null));
    }

    @Test
    void testResetCounter_KeepsMasksAndNeverGoesNegative() {
        mask.setCategoryActive("U", StreakType.DAILY_LOGIN.bit(), true);
        mask.setCategoryActive("V", StreakType.TRADING.bit(), true);

        mask.resetCounter();

        assertEquals(0, mask.totalActive());
        assertTrue(mask.isActive("U"));
        ActivityTransition transition = mask.setCategoryActive("U", StreakType.DAILY_LOGIN.bit(), false);
        assertEquals(0, transition.getCounterDelta());
        assertEquals(0, mask.totalActive());

        mask.setCategoryActive("W", StreakType.SOCIAL_INTERACTION.bit(), true);
        assertEquals(1, mask.totalActive());
    }

    @Test
    void testInvalidBitRejected() {
        assertThrows(IllegalArgumentException.class, () -> mask.setCategoryActive("U", 5, true));
        assertThrows(IllegalArgumentException.class, () -> mask.setCategoryActive("U", -1, true));
        assertThrows(IllegalArgumentException.class, () -> mask.setCategoryActive("", 0, true));
    }
}
