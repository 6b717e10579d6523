package com.leaderboard.ranking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RankedRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RankedRegistryApplication.class, args);
    }
}
