package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.leaderboard.ranking.model.RankedEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardResponse {
    private String category;
    private String timeframe;
    private List<RankedEntry> entries;
    private Integer totalEntries;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}
