package com.leaderboard.ranking;

import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.Timeframe;
import com.leaderboard.ranking.security.MutationGuard;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "ranking.storage.directory=target/test-data")
@AutoConfigureMockMvc
class RankedRegistryApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void scoreWriteIsVisibleThroughReads() throws Exception {
        String board = "/api/v1/leaderboards/" + LeaderboardCategory.GUILD_CONTRIBUTION + "/" + Timeframe.MONTHLY;

        mockMvc.perform(put(board + "/entities/erin")
                        .header(MutationGuard.CALLER_HEADER, "score-service")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"score\": 42}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rank").value(1));

        mockMvc.perform(get(board + "/entities/erin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(42));

        mockMvc.perform(get("/api/v1/activity/erin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeLeaderboards[0]").value("GUILD_CONTRIBUTION:MONTHLY"));
    }

    @Test
    void mutationWithoutRoleIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/admin/leaderboards/XP_TOTAL/DAILY/reset")
                        .header(MutationGuard.CALLER_HEADER, "score-service"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));
    }
}
