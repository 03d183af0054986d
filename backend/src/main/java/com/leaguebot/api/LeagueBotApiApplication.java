package com.leaguebot.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeagueBotApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(LeagueBotApiApplication.class, args);
    }
}
