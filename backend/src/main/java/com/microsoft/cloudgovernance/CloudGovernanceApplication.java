package com.microsoft.cloudgovernance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cloud Governance Assessment Engine
 *
 * Runs naming and tagging governance assessments against Azure environments,
 * scores them and keeps the findings for review.
 */
@SpringBootApplication
@EnableCaching
@EnableScheduling
public class CloudGovernanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudGovernanceApplication.class, args);
    }
}
