package com.asad.lineup_tracker;

import com.asad.lineup_tracker.config.LineupProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LineupProperties.class)
public class LineupTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineupTrackerApplication.class, args);
    }
}
