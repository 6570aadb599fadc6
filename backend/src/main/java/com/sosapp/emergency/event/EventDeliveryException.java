package com.sosapp.emergency.event;

public class EventDeliveryException extends RuntimeException {

    public EventDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
