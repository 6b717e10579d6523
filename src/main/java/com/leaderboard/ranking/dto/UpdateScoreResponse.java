package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.leaderboard.ranking.model.ScoreUpdate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpdateScoreResponse {
    private String category;
    private String timeframe;
    private String entity;
    private Long score;
    // null when the entity holds no position
    private Integer rank;
    private String evicted;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    public static UpdateScoreResponse from(ScoreUpdate update, Instant updatedAt) {
        return UpdateScoreResponse.builder()
            .category(update.getCategory().name())
            .timeframe(update.getTimeframe().name())
            .entity(update.getEntity())
            .score(update.getScore())
            .rank(update.getRank().isPresent() ? update.getRank().getAsInt() : null)
            .evicted(update.getEvicted())
            .updatedAt(updatedAt)
            .build();
    }
}
