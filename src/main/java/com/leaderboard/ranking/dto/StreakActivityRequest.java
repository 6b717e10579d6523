package com.leaderboard.ranking.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreakActivityRequest {
    @NotNull(message = "Current streak cannot be null")
    @Min(value = 0, message = "Current streak cannot be negative")
    private Long currentStreak;
}
