package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordSummary {
    private long bestValue;
    private String holder;
    private Map<String, Long> categoryBest;
    private Map<String, String> categoryHolder;
}
