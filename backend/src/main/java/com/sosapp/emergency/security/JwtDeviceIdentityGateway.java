package com.sosapp.emergency.security;

import com.sosapp.emergency.service.DeviceIdentity;
import com.sosapp.emergency.service.DeviceIdentityGateway;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JwtDeviceIdentityGateway implements DeviceIdentityGateway {

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    public Optional<DeviceIdentity> verify(String deviceToken) {
        if (deviceToken == null || deviceToken.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = jwtTokenProvider.parseClaims(deviceToken);
            if (!jwtTokenProvider.isDeviceToken(claims)) {
                log.warn("Non-device token presented as device credentials");
                return Optional.empty();
            }
            String deviceId = claims.get("deviceId", String.class);
            Long userId = claims.get("userId", Long.class);
            if (deviceId == null || userId == null) {
                return Optional.empty();
            }
            return Optional.of(new DeviceIdentity(deviceId, userId));
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Device token rejected: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
