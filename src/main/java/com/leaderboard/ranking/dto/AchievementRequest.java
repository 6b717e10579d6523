package com.leaderboard.ranking.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AchievementRequest {
    @NotNull(message = "Earned XP cannot be null")
    @Min(value = 0, message = "Earned XP cannot be negative")
    private Long xpEarned;

    @NotNull(message = "Earned badges cannot be null")
    @Min(value = 0, message = "Earned badges cannot be negative")
    private Long badgesEarned;
}
