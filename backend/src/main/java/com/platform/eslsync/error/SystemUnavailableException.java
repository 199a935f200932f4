package com.platform.eslsync.error;

/**
 * Exception for backing system errors (database, AIMS, sync queue).
 */
public class SystemUnavailableException extends EslSyncException {
    
    private final String systemName;
    
    public SystemUnavailableException(ErrorCode errorCode, String systemName, String message) {
        super(errorCode, message);
        this.systemName = systemName;
    }
    
    public SystemUnavailableException(ErrorCode errorCode, String systemName, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.systemName = systemName;
    }
    
    public static SystemUnavailableException database(String message, Throwable cause) {
        return new SystemUnavailableException(
            ErrorCode.DATABASE_ERROR,
            "database",
            message,
            cause
        );
    }
    
    public static SystemUnavailableException syncQueue(String message, Throwable cause) {
        return new SystemUnavailableException(
            ErrorCode.RESYNC_QUEUE_ERROR,
            "sync-queue",
            message,
            cause
        );
    }
    
    public String getSystemName() {
        return systemName;
    }
}
