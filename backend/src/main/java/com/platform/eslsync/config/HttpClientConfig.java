package com.platform.eslsync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Configuration for HTTP clients used to reach AIMS.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public HttpClient aimsHttpClient(AimsProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getConnectionTimeoutMs()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }
}
