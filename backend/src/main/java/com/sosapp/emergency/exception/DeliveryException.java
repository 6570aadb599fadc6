package com.sosapp.emergency.exception;

/**
 * Notification provider failure. Contained by the notification retry policy.
 */
public class DeliveryException extends RuntimeException {
    private final String errorCode;

    public DeliveryException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public DeliveryException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
