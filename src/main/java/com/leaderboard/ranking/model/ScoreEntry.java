package com.leaderboard.ranking.model;

import lombok.Value;

@Value
public class ScoreEntry {
    String entity;
    long score;
}
