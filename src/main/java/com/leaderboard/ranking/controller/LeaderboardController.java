package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.dto.BatchUpdateRequest;
import com.leaderboard.ranking.dto.IncrementScoreRequest;
import com.leaderboard.ranking.dto.LeaderboardResponse;
import com.leaderboard.ranking.dto.UpdateScoreRequest;
import com.leaderboard.ranking.dto.UpdateScoreResponse;
import com.leaderboard.ranking.model.LeaderboardCategory;
import com.leaderboard.ranking.model.RankedEntry;
import com.leaderboard.ranking.model.ScoreUpdate;
import com.leaderboard.ranking.model.Timeframe;
import com.leaderboard.ranking.model.TopEntities;
import com.leaderboard.ranking.security.MutationGuard;
import com.leaderboard.ranking.security.Operation;
import com.leaderboard.ranking.service.LeaderboardService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/leaderboards")
public class LeaderboardController {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);

    private final LeaderboardService leaderboardService;
    private final MutationGuard mutationGuard;
    private final Clock clock;

    @Autowired
    public LeaderboardController(LeaderboardService leaderboardService, MutationGuard mutationGuard, Clock clock) {
        this.leaderboardService = leaderboardService;
        this.mutationGuard = mutationGuard;
        this.clock = clock;
    }

    /**
     * Set the score of an entity.
     * PUT /api/v1/leaderboards/{category}/{timeframe}/entities/{entity}
     */
    @PutMapping("/{category}/{timeframe}/entities/{entity}")
    public ResponseEntity<UpdateScoreResponse> updateScore(
            @PathVariable String category,
            @PathVariable String timeframe,
            @PathVariable String entity,
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @Valid @RequestBody UpdateScoreRequest request) {

        logger.info("Received PUT request to update score - board: {}:{}, entity: {}, score: {}",
            category, timeframe, entity, request.getScore());

        try {
            mutationGuard.authorize(caller, Operation.UPDATE_SCORE);
            ScoreUpdate update = leaderboardService.updateScore(entity,
                LeaderboardCategory.parse(category), Timeframe.parse(timeframe), request.getScore());

            logger.info("Successfully updated score - board: {}:{}, entity: {}, score: {}, rank: {}",
                update.getCategory(), update.getTimeframe(), entity, update.getScore(), update.getRank());

            return ResponseEntity.ok(UpdateScoreResponse.from(update, Instant.now(clock)));
        } catch (Exception e) {
            logger.error("Error updating score - board: {}:{}, entity: {}, error: {}",
                category, timeframe, entity, e.getMessage());
            throw e;
        }
    }

    /**
     * Add to the score of an entity.
     * POST /api/v1/leaderboards/{category}/{timeframe}/entities/{entity}/increment
     */
    @PostMapping("/{category}/{timeframe}/entities/{entity}/increment")
    public ResponseEntity<UpdateScoreResponse> incrementScore(
            @PathVariable String category,
            @PathVariable String timeframe,
            @PathVariable String entity,
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @Valid @RequestBody IncrementScoreRequest request) {

        logger.info("Received POST request to increment score - board: {}:{}, entity: {}, delta: {}",
            category, timeframe, entity, request.getDelta());

        try {
            mutationGuard.authorize(caller, Operation.UPDATE_SCORE);
            ScoreUpdate update = leaderboardService.incrementScore(entity,
                LeaderboardCategory.parse(category), Timeframe.parse(timeframe), request.getDelta());
            return ResponseEntity.ok(UpdateScoreResponse.from(update, Instant.now(clock)));
        } catch (Exception e) {
            logger.error("Error incrementing score - board: {}:{}, entity: {}, error: {}",
                category, timeframe, entity, e.getMessage());
            throw e;
        }
    }

    /**
     * Set several scores at once; all or nothing.
     * POST /api/v1/leaderboards/{category}/{timeframe}/batch
     */
    @PostMapping("/{category}/{timeframe}/batch")
    public ResponseEntity<List<UpdateScoreResponse>> batchUpdateScores(
            @PathVariable String category,
            @PathVariable String timeframe,
            @RequestHeader(value = MutationGuard.CALLER_HEADER, required = false) String caller,
            @RequestBody BatchUpdateRequest request) {

        logger.info("Received POST request for batch update - board: {}:{}, size: {}",
            category, timeframe, request.getEntities() == null ? 0 : request.getEntities().size());

        try {
            mutationGuard.authorize(caller, Operation.UPDATE_SCORE);
            List<ScoreUpdate> updates = leaderboardService.batchUpdateScores(request.getEntities(),
                LeaderboardCategory.parse(category), Timeframe.parse(timeframe), request.getScores());
            Instant now = Instant.now(clock);
            return ResponseEntity.ok(updates.stream()
                .map(update -> UpdateScoreResponse.from(update, now))
                .collect(Collectors.toList()));
        } catch (Exception e) {
            logger.error("Error in batch update - board: {}:{}, error: {}", category, timeframe, e.getMessage());
            throw e;
        }
    }

    /**
     * GET /api/v1/leaderboards/{category}/{timeframe}?limit=N
     */
    @GetMapping("/{category}/{timeframe}")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(
            @PathVariable String category,
            @PathVariable String timeframe,
            @RequestParam(defaultValue = "10") int limit) {

        logger.debug("Received GET request for leaderboard - board: {}:{}, limit: {}", category, timeframe, limit);

        LeaderboardCategory parsedCategory = LeaderboardCategory.parse(category);
        Timeframe parsedTimeframe = Timeframe.parse(timeframe);
        List<RankedEntry> entries = leaderboardService.getLeaderboard(parsedCategory, parsedTimeframe, limit);
        return ResponseEntity.ok(toResponse(parsedCategory, parsedTimeframe, entries));
    }

    /**
     * GET /api/v1/leaderboards/{category}/{timeframe}/page?offset=O&count=C
     */
    @GetMapping("/{category}/{timeframe}/page")
    public ResponseEntity<LeaderboardResponse> getLeaderboardPage(
            @PathVariable String category,
            @PathVariable String timeframe,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "10") int count) {

        LeaderboardCategory parsedCategory = LeaderboardCategory.parse(category);
        Timeframe parsedTimeframe = Timeframe.parse(timeframe);
        List<RankedEntry> entries = leaderboardService.getLeaderboardPage(parsedCategory, parsedTimeframe, offset, count);
        return ResponseEntity.ok(toResponse(parsedCategory, parsedTimeframe, entries));
    }

    /**
     * Entities and scores as parallel lists.
     * GET /api/v1/leaderboards/{category}/{timeframe}/top?limit=N
     */
    @GetMapping("/{category}/{timeframe}/top")
    public ResponseEntity<TopEntities> getTopEntities(
            @PathVariable String category,
            @PathVariable String timeframe,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(leaderboardService.getTopEntities(
            LeaderboardCategory.parse(category), Timeframe.parse(timeframe), limit));
    }

    /**
     * Score and rank of one entity; 404 when it holds no position.
     * GET /api/v1/leaderboards/{category}/{timeframe}/entities/{entity}
     */
    @GetMapping("/{category}/{timeframe}/entities/{entity}")
    public ResponseEntity<RankedEntry> getUserScore(
            @PathVariable String category,
            @PathVariable String timeframe,
            @PathVariable String entity) {
        return leaderboardService.getUserScore(entity, LeaderboardCategory.parse(category), Timeframe.parse(timeframe))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private LeaderboardResponse toResponse(LeaderboardCategory category, Timeframe timeframe, List<RankedEntry> entries) {
        return LeaderboardResponse.builder()
            .category(category.name())
            .timeframe(timeframe.name())
            .entries(entries)
            .totalEntries(leaderboardService.getTotalEntries(category, timeframe))
            .retrievedAt(Instant.now(clock))
            .build();
    }
}
