package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.dto.ActiveTotalResponse;
import com.leaderboard.ranking.dto.ActivityResponse;
import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.PartitionKey;
import com.leaderboard.ranking.model.RecordSummary;
import com.leaderboard.ranking.model.Timeframe;
import com.leaderboard.ranking.service.LeaderboardService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only views of the activity mask and the global score record.
 */
@RestController
@RequestMapping("/api/v1")
public class ActivityController {

    private final LeaderboardService leaderboardService;

    @Autowired
    public ActivityController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    @GetMapping("/activity/{entity}")
    public ResponseEntity<ActivityResponse> getActivity(@PathVariable String entity) {
        long mask = leaderboardService.activeCategories(entity);
        return ResponseEntity.ok(ActivityResponse.builder()
            .entity(entity)
            .active(mask != 0L)
            .activeCategories(mask)
            .activeLeaderboards(decode(mask))
            .build());
    }

    @GetMapping("/activity")
    public ResponseEntity<ActiveTotalResponse> getTotalActive() {
        return ResponseEntity.ok(new ActiveTotalResponse(leaderboardService.totalActive()));
    }

    @GetMapping("/records")
    public ResponseEntity<RecordSummary> getGlobalRecord() {
        return ResponseEntity.ok(leaderboardService.getGlobalRecord());
    }

    private static List<String> decode(long mask) {
        List<String> boards = new ArrayList<>();
        for (LeaderboardCategory category : LeaderboardCategory.values()) {
            for (Timeframe timeframe : Timeframe.values()) {
                PartitionKey key = PartitionKey.of(category, timeframe);
                if ((mask & (1L << key.activityBit())) != 0L) {
                    boards.add(key.storageKey());
                }
            }
        }
        return boards;
    }
}
