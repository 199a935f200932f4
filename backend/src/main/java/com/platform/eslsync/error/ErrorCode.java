package com.platform.eslsync.error;

/**
 * Standardized error codes for the ESL sync verifier.
 * 
 * Format: ESL-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (conflict)
 * - 4xx: System errors (database, AIMS, sync queue)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("ESL-100", "Validation error", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("ESL-102", "Missing required field", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    VERIFICATION_IN_PROGRESS("ESL-310", "Verification run already in progress", ErrorCategory.RECOVERABLE),
    
    // ==================== System Errors (4xx) ====================
    
    DATABASE_ERROR("ESL-400", "Database error", ErrorCategory.FATAL),
    AIMS_UNAVAILABLE("ESL-440", "AIMS unavailable", ErrorCategory.RECOVERABLE),
    AIMS_REQUEST_FAILED("ESL-441", "AIMS request failed", ErrorCategory.RECOVERABLE),
    AIMS_NOT_CONFIGURED("ESL-442", "No AIMS configuration for store", ErrorCategory.RECOVERABLE),
    RESYNC_QUEUE_ERROR("ESL-450", "Sync queue error", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("ESL-900", "Internal server error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - caller can retry, usually on the next run.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - system is in bad state, may require intervention.
         */
        FATAL
    }
}
