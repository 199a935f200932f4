package com.platform.eslsync.error;

/**
 * Failure talking to AIMS. Transport and application errors both end up here.
 */
public class RemoteGatewayException extends SystemUnavailableException {
    
    private static final String SYSTEM = "aims";
    
    static final int MAX_BODY_LENGTH = 200;
    
    private final int statusCode;
    
    private RemoteGatewayException(ErrorCode errorCode, String message, int statusCode, Throwable cause) {
        super(errorCode, SYSTEM, message, cause);
        this.statusCode = statusCode;
    }
    
    public static RemoteGatewayException notConfigured(String storeId) {
        return new RemoteGatewayException(
            ErrorCode.AIMS_NOT_CONFIGURED,
            "No AIMS configuration for store " + storeId,
            0,
            null
        );
    }
    
    public static RemoteGatewayException httpStatus(int statusCode, String body) {
        return new RemoteGatewayException(
            ErrorCode.AIMS_REQUEST_FAILED,
            "HTTP " + statusCode + bodyExcerpt(body),
            statusCode,
            null
        );
    }
    
    public static RemoteGatewayException unreachable(String message, Throwable cause) {
        return new RemoteGatewayException(
            ErrorCode.AIMS_UNAVAILABLE,
            message != null ? message : "connection failed",
            0,
            cause
        );
    }
    
    public static RemoteGatewayException malformed(String message, Throwable cause) {
        return new RemoteGatewayException(
            ErrorCode.AIMS_REQUEST_FAILED,
            "Unreadable AIMS response: " + message,
            0,
            cause
        );
    }
    
    private static String bodyExcerpt(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return trimmed.length() <= MAX_BODY_LENGTH
            ? " " + trimmed
            : " " + trimmed.substring(0, MAX_BODY_LENGTH) + "...";
    }
    
    /**
     * HTTP status of the failed call, 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
