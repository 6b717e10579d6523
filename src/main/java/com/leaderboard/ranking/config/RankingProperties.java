package com.leaderboard.ranking.config;

import com.leaderboard.ranking.engine.AggregationStrategy;
import com.leaderboard.ranking.model.Timeframe;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {

    // Settings a partition starts with until an admin writes its config.
    private Defaults defaults = new Defaults();

    // Timeframe that startNewSeason reconfigures for a category.
    private Timeframe seasonTimeframe = Timeframe.DAILY;

    private Activity activity = new Activity();

    private Records records = new Records();

    private Streaks streaks = new Streaks();

    private Security security = new Security();

    private Storage storage = new Storage();

    @Data
    public static class Defaults {
        private boolean active = true;
        private int maxEntries = 1000;
        private Duration updateCooldown = Duration.ZERO;
    }

    @Data
    public static class Activity {
        private Duration inactivityThreshold = Duration.ofDays(7);
    }

    @Data
    public static class Records {
        /** Leaderboards accept only {@code PER_EVENT}; streak totals always sum their components. */
        private AggregationStrategy strategy = AggregationStrategy.PER_EVENT;
    }

    @Data
    public static class Streaks {
        private int leaderboardSize = 100;
        private Duration inactivityThreshold = Duration.ofDays(7);
    }

    @Data
    public static class Security {
        // When disabled every caller may mutate; pause gating still applies.
        private boolean enabled = true;
        private List<String> admins = new ArrayList<>();
        private List<String> scoreManagers = new ArrayList<>();
        private List<String> statsManagers = new ArrayList<>();
    }

    @Data
    public static class Storage {
        private String directory = "./data";
    }
}
