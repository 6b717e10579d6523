package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.exception.UnauthorizedException;
import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.SeasonConfig;
import com.leaderboard.ranking.model.Timeframe;
import com.leaderboard.ranking.security.MutationGuard;
import com.leaderboard.ranking.security.Operation;
import com.leaderboard.ranking.service.LeaderboardService;
import com.leaderboard.ranking.service.StreakStatisticsService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LeaderboardManagementController.class)
class LeaderboardManagementControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LeaderboardService leaderboardService;

    @MockBean
    private StreakStatisticsService streakStatisticsService;

    @MockBean
    private MutationGuard mutationGuard;

    @Test
    void resetLeaderboard_success() throws Exception {
        mockMvc.perform(post("/api/v1/admin/leaderboards/QUEST_COMPLETION/WEEKLY/reset")
                        .header(MutationGuard.CALLER_HEADER, "admin"))
                .andExpect(status().isNoContent());

        verify(mutationGuard).authorize("admin", Operation.RESET_LEADERBOARD);
        verify(leaderboardService).resetLeaderboard(LeaderboardCategory.QUEST_COMPLETION, Timeframe.WEEKLY);
    }

    @Test
    void resetLeaderboard_unauthorized_returns403() throws Exception {
        doThrow(new UnauthorizedException("Caller scorer lacks role ADMIN"))
            .when(mutationGuard).authorize("scorer", Operation.RESET_LEADERBOARD);

        mockMvc.perform(post("/api/v1/admin/leaderboards/QUEST_COMPLETION/WEEKLY/reset")
                        .header(MutationGuard.CALLER_HEADER, "scorer"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(leaderboardService);
    }

    @Test
    void resetStreakStats_success() throws Exception {
        mockMvc.perform(post("/api/v1/admin/streaks/reset")
                        .header(MutationGuard.CALLER_HEADER, "admin"))
                .andExpect(status().isNoContent());

        verify(mutationGuard).authorize("admin", Operation.RESET_STATS);
        verify(streakStatisticsService).resetGlobalStats();
    }

    @Test
    void resetStreakStats_unauthorized_returns403() throws Exception {
        doThrow(new UnauthorizedException("Caller stats-service lacks role ADMIN"))
            .when(mutationGuard).authorize("stats-service", Operation.RESET_STATS);

        mockMvc.perform(post("/api/v1/admin/streaks/reset")
                        .header(MutationGuard.CALLER_HEADER, "stats-service"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(streakStatisticsService);
    }

    @Test
    void setConfig_success() throws Exception {
        when(leaderboardService.setConfig(eq(LeaderboardCategory.XP_TOTAL), eq(Timeframe.DAILY), any(SeasonConfig.class)))
            .thenAnswer(invocation -> invocation.getArgument(2));

        mockMvc.perform(put("/api/v1/admin/leaderboards/XP_TOTAL/DAILY/config")
                        .header(MutationGuard.CALLER_HEADER, "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\": true, \"maxEntries\": 50, \"updateCooldownSeconds\": 60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxEntries").value(50))
                .andExpect(jsonPath("$.updateCooldownSeconds").value(60))
                .andExpect(jsonPath("$.seasonDurationSeconds").value(0));

        ArgumentCaptor<SeasonConfig> captor = ArgumentCaptor.forClass(SeasonConfig.class);
        verify(leaderboardService).setConfig(eq(LeaderboardCategory.XP_TOTAL), eq(Timeframe.DAILY), captor.capture());
        assertEquals(Duration.ofMinutes(1), captor.getValue().getUpdateCooldown());
    }

    @Test
    void setConfig_missingMaxEntries_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/admin/leaderboards/XP_TOTAL/DAILY/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\": true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));

        verifyNoInteractions(leaderboardService);
    }

    @Test
    void startNewSeason_success() throws Exception {
        Instant start = Instant.parse("2024-07-01T00:00:00Z");
        when(leaderboardService.getSeasonTimeframe()).thenReturn(Timeframe.DAILY);
        when(leaderboardService.startNewSeason(LeaderboardCategory.XP_TOTAL, Duration.ofDays(1)))
            .thenReturn(SeasonConfig.builder()
                .active(true)
                .maxEntries(1000)
                .seasonStartTime(start)
                .seasonDuration(Duration.ofDays(1))
                .build());

        mockMvc.perform(post("/api/v1/admin/leaderboards/XP_TOTAL/season")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"durationSeconds\": 86400}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timeframe").value("DAILY"))
                .andExpect(jsonPath("$.seasonDurationSeconds").value(86400))
                .andExpect(jsonPath("$.seasonStartTime").value("2024-07-01T00:00:00.000Z"));

        verify(mutationGuard).authorize(isNull(), eq(Operation.START_SEASON));
    }

    @Test
    void cleanupInactive_success() throws Exception {
        when(leaderboardService.cleanupInactive(List.of("a", "b"))).thenReturn(List.of("a"));
        when(leaderboardService.totalActive()).thenReturn(4L);

        mockMvc.perform(post("/api/v1/admin/activity/cleanup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entities\": [\"a\", \"b\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deactivated[0]").value("a"))
                .andExpect(jsonPath("$.totalActive").value(4));
    }

    @Test
    void pauseAndUnpause() throws Exception {
        when(mutationGuard.isPaused()).thenReturn(true, false);

        mockMvc.perform(post("/api/v1/admin/pause").header(MutationGuard.CALLER_HEADER, "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true));
        mockMvc.perform(post("/api/v1/admin/unpause").header(MutationGuard.CALLER_HEADER, "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(false));

        verify(mutationGuard, times(2)).authorize("admin", Operation.PAUSE);
        verify(mutationGuard).pause();
        verify(mutationGuard).unpause();
    }
}
