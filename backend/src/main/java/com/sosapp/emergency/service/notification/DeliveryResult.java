package com.sosapp.emergency.service.notification;

/**
 * Provider verdict for one attempt.
 *
 * @param permanent the failure will not go away by retrying the same destination
 */
public record DeliveryResult(boolean success, String providerMessageId, String errorCode, String error, boolean permanent) {

    public static DeliveryResult sent(String providerMessageId) {
        return new DeliveryResult(true, providerMessageId, null, null, false);
    }

    public static DeliveryResult failed(String errorCode, String error, boolean permanent) {
        return new DeliveryResult(false, null, errorCode, error, permanent);
    }
}
