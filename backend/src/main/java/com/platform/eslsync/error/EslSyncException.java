package com.platform.eslsync.error;

/**
 * Base exception for all sync verifier exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class EslSyncException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected EslSyncException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected EslSyncException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected EslSyncException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
