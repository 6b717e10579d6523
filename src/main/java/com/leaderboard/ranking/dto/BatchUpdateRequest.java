package com.leaderboard.ranking.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parallel lists: {@code scores.get(i)} is the new score of {@code entities.get(i)}.
 * Emptiness and length checks are done by the service so they map to their own error codes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchUpdateRequest {
    private List<String> entities;
    private List<Long> scores;
}
