package com.platform.eslsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the AIMS article API.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "esl.aims")
public class AimsProperties {
    
    /**
     * AIMS API base URL, without trailing slash.
     */
    private String baseUrl = "http://localhost:8080";
    
    /**
     * AIMS company name the stores belong to.
     */
    private String company;
    
    /**
     * Bearer token sent with every request.
     */
    private String apiToken;
    
    private int pageSize = 100;
    
    /**
     * Hard stop for paging through one store's articles.
     */
    private int maxPages = 50;
    
    /**
     * Connection timeout in milliseconds.
     */
    private int connectionTimeoutMs = 5000;
    
    /**
     * Read timeout in milliseconds.
     */
    private int readTimeoutMs = 30000;
}
