package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.leaderboard.ranking.model.SeasonConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonConfigResponse {
    private String category;
    private String timeframe;
    private boolean active;
    private int maxEntries;
    private long updateCooldownSeconds;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant seasonStartTime;

    private long seasonDurationSeconds;

    public static SeasonConfigResponse from(String category, String timeframe, SeasonConfig config) {
        return SeasonConfigResponse.builder()
            .category(category)
            .timeframe(timeframe)
            .active(config.isActive())
            .maxEntries(config.getMaxEntries())
            .updateCooldownSeconds(config.getUpdateCooldown().getSeconds())
            .seasonStartTime(config.getSeasonStartTime())
            .seasonDurationSeconds(config.getSeasonDuration().getSeconds())
            .build();
    }
}
