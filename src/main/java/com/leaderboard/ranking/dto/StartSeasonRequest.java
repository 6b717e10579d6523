package com.leaderboard.ranking.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartSeasonRequest {
    @NotNull(message = "Duration cannot be null")
    @Min(value = 1, message = "Duration must be at least one second")
    private Long durationSeconds;
}
