package com.leaderboard.ranking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityResponse {
    private String entity;
    private boolean active;
    private long activeCategories;
    // storage keys ("CATEGORY:TIMEFRAME") of the boards behind the set bits
    private List<String> activeLeaderboards;
}
