package com.platform.eslsync.config;

import com.platform.eslsync.verification.ManualRunMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the drift verification job.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "esl.verification")
public class VerificationProperties {
    
    /**
     * Whether the periodic job is started with the application.
     */
    private boolean enabled = true;
    
    /**
     * Delay between the end of one run and the start of the next.
     */
    private long intervalMs = 5 * 60 * 1000L;
    
    /**
     * Delay of the warm-up run after start.
     */
    private long initialDelayMs = 10_000L;
    
    /**
     * Upper bound on SYNCED local records compared per store and run.
     */
    private int maxLocalRecordsPerStore = 100;
    
    /**
     * Upper bound on corrective jobs queued per store and run.
     */
    private int maxResyncPerStore = 10;
    
    private ManualRunMode manualRunMode = ManualRunMode.CONCURRENT;
}
