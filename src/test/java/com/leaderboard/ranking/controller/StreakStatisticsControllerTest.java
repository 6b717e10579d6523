package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.exception.UnauthorizedException;
import com.leaderboard.ranking.model.DailyStreakStats;
import com.leaderboard.ranking.model.GlobalStreakStats;
import com.leaderboard.ranking.model.StreakActivityResult;
import com.leaderboard.ranking.model.StreakType;
import com.leaderboard.ranking.model.UserStreakStats;
import com.leaderboard.ranking.security.MutationGuard;
import com.leaderboard.ranking.security.Operation;
import com.leaderboard.ranking.service.StreakStatisticsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StreakStatisticsController.class)
class StreakStatisticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StreakStatisticsService streakStatisticsService;

    @MockBean
    private MutationGuard mutationGuard;

    @Test
    void updateUserActivity_notAdmitted_stillSucceeds() throws Exception {
        when(streakStatisticsService.updateUserActivity("carol", StreakType.TRADING, 3L))
            .thenReturn(StreakActivityResult.builder()
                .entity("carol")
                .streakType(StreakType.TRADING)
                .currentStreak(3L)
                .activeTypes(StreakType.TRADING.mask())
                .active(true)
                .admitted(false)
                .currentTotal(3L)
                .build());

        mockMvc.perform(put("/api/v1/streaks/trading/entities/carol")
                        .header(MutationGuard.CALLER_HEADER, "stats-service")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentStreak\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.admitted").value(false))
                .andExpect(jsonPath("$.rank").doesNotExist())
                .andExpect(jsonPath("$.activeTypes").value(4));

        verify(mutationGuard).authorize("stats-service", Operation.UPDATE_ACTIVITY);
    }

    @Test
    void updateUserActivity_unknownType_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/streaks/SLEEPING/entities/carol")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentStreak\": 3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_CATEGORY"));

        verifyNoInteractions(streakStatisticsService);
    }

    @Test
    void getGlobalStats_success() throws Exception {
        Map<StreakType, Long> counts = new EnumMap<>(StreakType.class);
        counts.put(StreakType.DAILY_LOGIN, 2L);
        counts.put(StreakType.TRADING, 0L);
        when(streakStatisticsService.getGlobalStats())
            .thenReturn(new GlobalStreakStats(2L, 14L, "dave", 20L, counts));

        mockMvc.perform(get("/api/v1/streaks/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalActiveStreakers").value(2))
                .andExpect(jsonPath("$.streakLeader").value("dave"))
                .andExpect(jsonPath("$.streakTypeCounts.DAILY_LOGIN").value(2));
    }

    @Test
    void getRank_ranked_success() throws Exception {
        when(streakStatisticsService.getRank("carol", StreakType.GOVERNANCE)).thenReturn(OptionalInt.of(2));

        mockMvc.perform(get("/api/v1/streaks/governance/entities/carol/rank"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.streakType").value("GOVERNANCE"))
                .andExpect(jsonPath("$.rank").value(2));
    }

    @Test
    void getRank_unranked_returns404() throws Exception {
        when(streakStatisticsService.getRank("carol", StreakType.GOVERNANCE)).thenReturn(OptionalInt.empty());

        mockMvc.perform(get("/api/v1/streaks/GOVERNANCE/entities/carol/rank"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getStreakTypeCount_success() throws Exception {
        when(streakStatisticsService.getStreakTypeCount(StreakType.QUEST_COMPLETION)).thenReturn(3L);

        mockMvc.perform(get("/api/v1/streaks/1/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.streakType").value("QUEST_COMPLETION"))
                .andExpect(jsonPath("$.activeStreakers").value(3));
    }

    @Test
    void getDailyStats_success() throws Exception {
        LocalDate day = LocalDate.of(2024, 5, 1);
        when(streakStatisticsService.getDailyStats(day)).thenReturn(new DailyStreakStats(day, 2L, 3L, 1L));

        mockMvc.perform(get("/api/v1/streaks/daily/2024-05-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeUsers").value(2))
                .andExpect(jsonPath("$.totalActivities").value(3))
                .andExpect(jsonPath("$.newStreakers").value(1));
    }

    @Test
    void recordAchievement_success() throws Exception {
        when(streakStatisticsService.recordAchievement("carol", 100L, 2L))
            .thenReturn(UserStreakStats.builder()
                .entity("carol")
                .totalAchievements(1L)
                .totalXpEarned(100L)
                .totalBadgesEarned(2L)
                .build());

        mockMvc.perform(post("/api/v1/streaks/entities/carol/achievements")
                        .header(MutationGuard.CALLER_HEADER, "stats-service")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"xpEarned\": 100, \"badgesEarned\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAchievements").value(1))
                .andExpect(jsonPath("$.totalXpEarned").value(100));

        verify(mutationGuard).authorize("stats-service", Operation.RECORD_ACHIEVEMENT);
    }

    @Test
    void recordAchievement_negativeXp_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/streaks/entities/carol/achievements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"xpEarned\": -1, \"badgesEarned\": 0}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(streakStatisticsService);
    }

    @Test
    void recordAchievement_unauthorized_returns403() throws Exception {
        doThrow(new UnauthorizedException("Caller carol lacks role STATS_MANAGER"))
            .when(mutationGuard).authorize("carol", Operation.RECORD_ACHIEVEMENT);

        mockMvc.perform(post("/api/v1/streaks/entities/carol/achievements")
                        .header(MutationGuard.CALLER_HEADER, "carol")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"xpEarned\": 5, \"badgesEarned\": 0}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(streakStatisticsService);
    }
}
