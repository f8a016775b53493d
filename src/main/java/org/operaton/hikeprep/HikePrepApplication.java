package org.operaton.hikeprep;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Main Spring Boot application class for HikePrep.
 * HikePrep turns a target hike's elevation profile into a periodized,
 * day-by-day training plan with treadmill incline and speed segments.
 */
@SpringBootApplication
@Slf4j
public class HikePrepApplication {

    public static void main(String[] args) {
        SpringApplication.run(HikePrepApplication.class, args);
        log.info("HikePrep application started successfully!");
    }

    /**
     * Source of the current date for default start dates. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
