package com.leaderboard.ranking.dto;

import com.leaderboard.ranking.model.SeasonConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeasonConfigRequest {
    @NotNull(message = "Active flag cannot be null")
    private Boolean active;

    @NotNull(message = "Max entries cannot be null")
    @Min(value = 1, message = "Max entries must be at least 1")
    private Integer maxEntries;

    @Min(value = 0, message = "Update cooldown cannot be negative")
    private long updateCooldownSeconds;

    private Instant seasonStartTime;

    // 0 keeps the season open indefinitely
    @Min(value = 0, message = "Season duration cannot be negative")
    private long seasonDurationSeconds;

    public SeasonConfig toSeasonConfig() {
        return SeasonConfig.builder()
            .active(active)
            .maxEntries(maxEntries)
            .updateCooldown(Duration.ofSeconds(updateCooldownSeconds))
            .seasonStartTime(seasonStartTime)
            .seasonDuration(Duration.ofSeconds(seasonDurationSeconds))
            .build();
    }
}
