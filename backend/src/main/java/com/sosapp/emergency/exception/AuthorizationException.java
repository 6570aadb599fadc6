package com.sosapp.emergency.exception;

/**
 * Caller is authenticated but is not the owner, an authorized contact or the paired device.
 */
public class AuthorizationException extends RuntimeException {
    public AuthorizationException(String message) {
        super(message);
    }
}
