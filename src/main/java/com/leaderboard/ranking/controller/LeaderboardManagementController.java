package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.dto.CleanupRequest;
import com.leaderboard.ranking.dto.CleanupResponse;
import com.leaderboard.ranking.dto.PauseStatusResponse;
import com.leaderboard.ranking.dto.SeasonConfigRequest;
import com.leaderboard.ranking.dto.SeasonConfigResponse;
import com.leaderboard.ranking.dto.StartSeasonRequest;
import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.SeasonConfig;
import com.leaderboard.ranking.model.Timeframe;
import com.leaderboard.ranking.security.MutationGuard;
import com.leaderboard.ranking.security.Operation;
import com.leaderboard.ranking.service.LeaderboardService;
import com.leaderboard.ranking.service.StreakStatisticsService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

/**
 * Administrative operations: leaderboard and streak statistics resets, per-board config, seasons,
 * inactivity cleanup and the write pause.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class LeaderboardManagementController {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardManagementController.class);

    private final LeaderboardService leaderboardService;
    private final StreakStatisticsService streakStatisticsService;
    private final MutationGuard mutationGuard;

    @Autowired
    public LeaderboardManagementController(
            LeaderboardService leaderboardService,
            StreakStatisticsService streakStatisticsService,
            MutationGuard mutationGuard) {
        this.leaderboardService = leaderboardService;
        this.streakStatisticsService = streakStatisticsService;
        this.mutationGuard = mutationGuard;
    }

    /**
     * POST /api/v1/admin/leaderboards/{category}/{timeframe}/reset
     */
    @PostMapping("/leaderboards/{category}/{timeframe}/reset")
    public ResponseEntity<Void> resetLeaderboard(
            @PathVariable String category,
            @PathVariable String timeframe,
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller) {

        logger.info("Received POST request to reset leaderboard - board: {}:{}, caller: {}", category, timeframe, caller);
        mutationGuard.authorize(caller, Operation.RESET_LEADERBOARD);
        leaderboardService.resetLeaderboard(LeaderboardCategory.parse(category), Timeframe.parse(timeframe));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/leaderboards/{category}/{timeframe}/config")
    public ResponseEntity<SeasonConfigResponse> getConfig(@PathVariable String category, @PathVariable String timeframe) {
        LeaderboardCategory parsedCategory = LeaderboardCategory.parse(category);
        Timeframe parsedTimeframe = Timeframe.parse(timeframe);
        SeasonConfig config = leaderboardService.getConfig(parsedCategory, parsedTimeframe);
        return ResponseEntity.ok(SeasonConfigResponse.from(parsedCategory.name(), parsedTimeframe.name(), config));
    }

    /**
     * PUT /api/v1/admin/leaderboards/{category}/{timeframe}/config
     */
    @PutMapping("/leaderboards/{category}/{timeframe}/config")
    public ResponseEntity<SeasonConfigResponse> setConfig(
            @PathVariable String category,
            @PathVariable String timeframe,
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @Valid @RequestBody SeasonConfigRequest request) {

        logger.info("Received PUT request to configure leaderboard - board: {}:{}, maxEntries: {}, caller: {}",
            category, timeframe, request.getMaxEntries(), caller);

        try {
            mutationGuard.authorize(caller, Operation.CONFIGURE);
            LeaderboardCategory parsedCategory = LeaderboardCategory.parse(category);
            Timeframe parsedTimeframe = Timeframe.parse(timeframe);
            SeasonConfig saved = leaderboardService.setConfig(parsedCategory, parsedTimeframe, request.toSeasonConfig());
            return ResponseEntity.ok(SeasonConfigResponse.from(parsedCategory.name(), parsedTimeframe.name(), saved));
        } catch (Exception e) {
            logger.error("Error configuring leaderboard - board: {}:{}, error: {}", category, timeframe, e.getMessage());
            throw e;
        }
    }

    /**
     * Start a season on the configured season timeframe of a category.
     * POST /api/v1/admin/leaderboards/{category}/season
     */
    @PostMapping("/leaderboards/{category}/season")
    public ResponseEntity<SeasonConfigResponse> startNewSeason(
            @PathVariable String category,
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @Valid @RequestBody StartSeasonRequest request) {

        logger.info("Received POST request to start season - category: {}, duration: {}s, caller: {}",
            category, request.getDurationSeconds(), caller);
        mutationGuard.authorize(caller, Operation.START_SEASON);
        LeaderboardCategory parsedCategory = LeaderboardCategory.parse(category);
        SeasonConfig season = leaderboardService.startNewSeason(parsedCategory,
            Duration.ofSeconds(request.getDurationSeconds()));
        return ResponseEntity.ok(SeasonConfigResponse.from(parsedCategory.name(),
            leaderboardService.getSeasonTimeframe().name(), season));
    }

    /**
     * POST /api/v1/admin/activity/cleanup
     */
    @PostMapping("/activity/cleanup")
    public ResponseEntity<CleanupResponse> cleanupInactive(
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @RequestBody CleanupRequest request) {

        mutationGuard.authorize(caller, Operation.CLEANUP);
        List<String> deactivated = leaderboardService.cleanupInactive(request.getEntities());
        return ResponseEntity.ok(new CleanupResponse(deactivated, leaderboardService.totalActive()));
    }

    /**
     * POST /api/v1/admin/streaks/cleanup
     */
    @PostMapping("/streaks/cleanup")
    public ResponseEntity<CleanupResponse> cleanupInactiveStreakers(
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @RequestBody CleanupRequest request) {

        mutationGuard.authorize(caller, Operation.CLEANUP);
        List<String> deactivated = streakStatisticsService.cleanupInactiveStreakers(request.getEntities());
        return ResponseEntity.ok(new CleanupResponse(deactivated,
            streakStatisticsService.getGlobalStats().getTotalActiveStreakers()));
    }

    /**
     * POST /api/v1/admin/streaks/reset
     */
    @PostMapping("/streaks/reset")
    public ResponseEntity<Void> resetStreakStats(
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller) {

        logger.info("Received POST request to reset streak statistics - caller: {}", caller);
        mutationGuard.authorize(caller, Operation.RESET_STATS);
        streakStatisticsService.resetGlobalStats();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/pause")
    public ResponseEntity<PauseStatusResponse> pause(
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller) {
        mutationGuard.authorize(caller, Operation.PAUSE);
        mutationGuard.pause();
        return ResponseEntity.ok(new PauseStatusResponse(mutationGuard.isPaused()));
    }

    @PostMapping("/unpause")
    public ResponseEntity<PauseStatusResponse> unpause(
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller) {
        mutationGuard.authorize(caller, Operation.PAUSE);
        mutationGuard.unpause();
        return ResponseEntity.ok(new PauseStatusResponse(mutationGuard.isPaused()));
    }

    @GetMapping("/pause")
    public ResponseEntity<PauseStatusResponse> getPauseStatus() {
        return ResponseEntity.ok(new PauseStatusResponse(mutationGuard.isPaused()));
    }
}
