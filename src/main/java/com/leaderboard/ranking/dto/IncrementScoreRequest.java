package com.leaderboard.ranking.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IncrementScoreRequest {
    @NotNull(message = "Delta cannot be null")
    @Min(value = 0, message = "Delta cannot be negative")
    private Long delta;
}
