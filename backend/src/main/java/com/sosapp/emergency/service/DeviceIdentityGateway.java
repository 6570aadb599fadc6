package com.sosapp.emergency.service;

import java.util.Optional;

/**
 * Authenticates paired devices that trigger emergencies on their own (fall detection and the like).
 */
public interface DeviceIdentityGateway {

    /**
     * @return the device and the user it is paired with, or empty when the token is not valid
     */
    Optional<DeviceIdentity> verify(String deviceToken);
}
