package com.sosapp.emergency.config;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class AllowedOriginResolver {

    private static final List<String> DEFAULT_DEV_ORIGINS = List.of(
            "http://localhost:3000",
            "http://127.0.0.1:3000",
            "http://localhost:19006"
    );

    private final SecurityProperties securityProperties;
    private final Environment environment;

    public AllowedOriginResolver(SecurityProperties securityProperties, Environment environment) {
        this.securityProperties = securityProperties;
        this.environment = environment;
    }

    public List<String> resolveCorsAllowedOrigins() {
        List<String> fromEnv = clean(splitOrigins(environment.getProperty("SOS_ALLOWED_ORIGINS")));
        if (!fromEnv.isEmpty()) {
            return fromEnv;
        }
        List<String> configured = clean(securityProperties.getCors().getAllowedOrigins());
        if (!configured.isEmpty()) {
            return configured;
        }
        if (isProd()) {
            throw new IllegalStateException("CORS allowed origins must be configured for production via " +
                    "SOS_ALLOWED_ORIGINS or sos.security.cors.allowed-origins");
        }
        return DEFAULT_DEV_ORIGINS;
    }

    private List<String> splitOrigins(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.asList(raw.split(","));
    }

    private List<String> clean(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .toList();
    }

    private boolean isProd() {
        return Arrays.stream(environment.getActiveProfiles())
                .anyMatch(profile -> "prod".equalsIgnoreCase(profile) || "production".equalsIgnoreCase(profile));
    }
}
