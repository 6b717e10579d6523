package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.leaderboard.ranking.model.StreakActivityResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreakActivityResponse {
    private String entity;
    private String streakType;
    private long currentStreak;
    private long currentTotal;
    private boolean active;
    private long activeTypes;
    private boolean admitted;
    private Integer rank;

    public static StreakActivityResponse from(StreakActivityResult result) {
        return StreakActivityResponse.builder()
            .entity(result.getEntity())
            .streakType(result.getStreakType().name())
            .currentStreak(result.getCurrentStreak())
            .currentTotal(result.getCurrentTotal())
            .active(result.isActive())
            .activeTypes(result.getActiveTypes())
            .admitted(result.isAdmitted())
            .rank(result.getRank().isPresent() ? result.getRank().getAsInt() : null)
            .build();
    }
}
