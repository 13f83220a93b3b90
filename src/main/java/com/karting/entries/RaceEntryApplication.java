package com.karting.entries;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the race-entry service:
 * <ul>
 *   <li>Paid, free and manual race entries with per-item tickets</li>
 *   <li>PayFast checkout forms and signed webhook reconciliation</li>
 *   <li>Pool engine rentals for the season</li>
 *   <li>Queued transactional e-mail and Kafka lifecycle events</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class RaceEntryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaceEntryApplication.class, args);
    }
}
