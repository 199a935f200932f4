package com.platform.eslsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ESL Sync Verifier Application
 * 
 * Background service that keeps the local replica of ESL-bound records honest
 * against the vendor AIMS platform:
 * - Periodic drift detection per sync-enabled store
 * - Bounded corrective re-sync queueing
 * - Operator-triggered verification over REST
 * - Structured logs and Micrometer metrics for every run
 */
@SpringBootApplication
public class EslSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(EslSyncApplication.class, args);
    }
}
