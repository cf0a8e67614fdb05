package com.gpufleet.governor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * GPU fleet governor: samples rented GPU machines, reclaims idle ones and enforces spending limits
 * per account and per ownership key. Passes are triggered over HTTP by an external scheduler.
 */
@SpringBootApplication
public class GovernorApplication {

    private static final Logger log = LoggerFactory.getLogger(GovernorApplication.class);

    public static void main(String[] args) {
        log.info("Starting GPU fleet governor");
        SpringApplication.run(GovernorApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
