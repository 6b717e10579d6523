package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.dto.AchievementRequest;
import com.leaderboard.ranking.dto.StreakActivityRequest;
import com.leaderboard.ranking.dto.StreakActivityResponse;
import com.leaderboard.ranking.dto.StreakLeaderResponse;
import com.leaderboard.ranking.dto.StreakRankResponse;
import com.leaderboard.ranking.dto.StreakTypeCountResponse;
import com.leaderboard.ranking.engine.RecordHolder;
import com.leaderboard.ranking.model.DailyStreakStats;
import com.leaderboard.ranking.model.GlobalStreakStats;
import com.leaderboard.ranking.model.RankedEntry;
import com.leaderboard.ranking.model.StreakActivityResult;
import com.leaderboard.ranking.model.StreakType;
import com.leaderboard.ranking.model.UserStreakStats;
import com.leaderboard.ranking.security.MutationGuard;
import com.leaderboard.ranking.security.Operation;
import com.leaderboard.ranking.service.StreakStatisticsService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

@RestController
@RequestMapping("/api/v1/streaks")
public class StreakStatisticsController {

    private static final Logger logger = LoggerFactory.getLogger(StreakStatisticsController.class);

    private final StreakStatisticsService streakStatisticsService;
    private final MutationGuard mutationGuard;

    @Autowired
    public StreakStatisticsController(StreakStatisticsService streakStatisticsService, MutationGuard mutationGuard) {
        this.streakStatisticsService = streakStatisticsService;
        this.mutationGuard = mutationGuard;
    }

    /**
     * Report the current streak of one type.
     * PUT /api/v1/streaks/{streakType}/entities/{entity}
     */
    @PutMapping("/{streakType}/entities/{entity}")
    public ResponseEntity<StreakActivityResponse> updateUserActivity(
            @PathVariable String streakType,
            @PathVariable String entity,
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @Valid @RequestBody StreakActivityRequest request) {

        logger.info("Received PUT request to update streak - type: {}, entity: {}, streak: {}",
            streakType, entity, request.getCurrentStreak());

        try {
            mutationGuard.authorize(caller, Operation.UPDATE_ACTIVITY);
            StreakActivityResult result = streakStatisticsService.updateUserActivity(entity,
                StreakType.parse(streakType), request.getCurrentStreak());
            return ResponseEntity.ok(StreakActivityResponse.from(result));
        } catch (Exception e) {
            logger.error("Error updating streak - type: {}, entity: {}, error: {}", streakType, entity, e.getMessage());
            throw e;
        }
    }

    @GetMapping("/{streakType}/leaderboard")
    public ResponseEntity<List<RankedEntry>> getLeaderboard(
            @PathVariable String streakType,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(streakStatisticsService.getLeaderboard(StreakType.parse(streakType), limit));
    }

    /**
     * Rank of one entity on a streak type leaderboard; 404 when it holds no position.
     * GET /api/v1/streaks/{streakType}/entities/{entity}/rank
     */
    @GetMapping("/{streakType}/entities/{entity}/rank")
    public ResponseEntity<StreakRankResponse> getRank(@PathVariable String streakType, @PathVariable String entity) {
        StreakType parsed = StreakType.parse(streakType);
        OptionalInt rank = streakStatisticsService.getRank(entity, parsed);
        if (!rank.isPresent()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(new StreakRankResponse(entity, parsed.name(), rank.getAsInt()));
    }

    @GetMapping("/{streakType}/count")
    public ResponseEntity<StreakTypeCountResponse> getStreakTypeCount(@PathVariable String streakType) {
        StreakType parsed = StreakType.parse(streakType);
        return ResponseEntity.ok(new StreakTypeCountResponse(parsed.name(),
            streakStatisticsService.getStreakTypeCount(parsed)));
    }

    /**
     * GET /api/v1/streaks/daily/{day} with an ISO date, e.g. 2024-05-01
     */
    @GetMapping("/daily/{day}")
    public ResponseEntity<DailyStreakStats> getDailyStats(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        return ResponseEntity.ok(streakStatisticsService.getDailyStats(day));
    }

    /**
     * POST /api/v1/streaks/entities/{entity}/achievements
     */
    @PostMapping("/entities/{entity}/achievements")
    public ResponseEntity<UserStreakStats> recordAchievement(
            @PathVariable String entity,
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @Valid @RequestBody AchievementRequest request) {

        logger.info("Received POST request to record achievement - entity: {}, xp: {}, badges: {}",
            entity, request.getXpEarned(), request.getBadgesEarned());

        try {
            mutationGuard.authorize(caller, Operation.RECORD_ACHIEVEMENT);
            return ResponseEntity.ok(streakStatisticsService.recordAchievement(entity,
                request.getXpEarned(), request.getBadgesEarned()));
        } catch (Exception e) {
            logger.error("Error recording achievement - entity: {}, error: {}", entity, e.getMessage());
            throw e;
        }
    }

    @GetMapping("/leaders")
    public ResponseEntity<List<StreakLeaderResponse>> getStreakTypeLeaders() {
        List<StreakLeaderResponse> leaders = new ArrayList<>();
        for (Map.Entry<StreakType, RecordHolder> entry : streakStatisticsService.getStreakTypeLeaders().entrySet()) {
            leaders.add(new StreakLeaderResponse(entry.getKey().name(),
                entry.getValue().getHolder(), entry.getValue().getValue()));
        }
        return ResponseEntity.ok(leaders);
    }

    @GetMapping("/stats")
    public ResponseEntity<GlobalStreakStats> getGlobalStats() {
        return ResponseEntity.ok(streakStatisticsService.getGlobalStats());
    }

    @GetMapping("/entities/{entity}")
    public ResponseEntity<UserStreakStats> getUserStats(@PathVariable String entity) {
        return ResponseEntity.ok(streakStatisticsService.getUserStats(entity));
    }
}
