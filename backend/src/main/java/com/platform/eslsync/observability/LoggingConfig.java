package com.platform.eslsync.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for operator requests and MDC helpers
 * for verification runs.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_RUN_ID = "verificationRunId";
    public static final String MDC_TRIGGER = "trigger";
    public static final String MDC_STORE_ID = "storeId";
    
    @Value("${spring.application.name:esl-sync-verifier}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);
        
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        private static final String MDC_REQUEST_PATH = "requestPath";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
            }
        }
    }
    
    /**
     * Set run information in MDC for logging.
     */
    public static void setRunContext(String runId, String trigger) {
        MDC.put(MDC_RUN_ID, runId);
        MDC.put(MDC_TRIGGER, trigger);
    }
    
    public static void clearRunContext() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_TRIGGER);
    }
    
    /**
     * Set the store being verified in MDC.
     */
    public static void setStoreContext(String storeId) {
        MDC.put(MDC_STORE_ID, storeId);
    }
    
    public static void clearStoreContext() {
        MDC.remove(MDC_STORE_ID);
    }
}
