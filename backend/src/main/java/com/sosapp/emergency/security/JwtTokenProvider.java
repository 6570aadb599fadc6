package com.sosapp.emergency.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import jakarta.annotation.PostConstruct;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

/**
 * HMAC tokens for app users and for paired devices. Device tokens carry {@code type=DEVICE} and a
 * {@code deviceId} claim and are only accepted on the auto-trigger endpoint.
 */
@Component
public class JwtTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(JwtTokenProvider.class);

    static final String TYPE_DEVICE = "DEVICE";

    @Value("${jwt.secret:}")
    private String jwtSecret;

    @Value("${jwt.expiration:3600000}")
    private long jwtExpirationMs;

    @Value("${jwt.device-expiration:2592000000}")
    private long deviceExpirationMs;

    @PostConstruct
    public void validateSecret() {
        if (jwtSecret == null || jwtSecret.isBlank()) {
            logger.error("Missing JWT secret. Set JWT_SECRET environment variable. Using an ephemeral key; issued tokens will not survive a restart.");
            jwtSecret = UUID.randomUUID() + UUID.randomUUID().toString();
        }
        if (jwtSecret.length() < 32) {
            logger.error("JWT secret must be at least 32 characters. Using an ephemeral key.");
            jwtSecret = UUID.randomUUID() + UUID.randomUUID().toString();
        }
    }

    private SecretKey getSigningKey() {
        byte[] keyBytes = jwtSecret.getBytes(StandardCharsets.UTF_8);
        return Keys.hmacShaKeyFor(keyBytes);
    }

    public String generateToken(String username, Long userId, String role) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        return Jwts.builder()
                .subject(username)
                .claim("userId", userId)
                .claim("role", role)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(getSigningKey(), Jwts.SIG.HS256)
                .compact();
    }

    public String generateDeviceToken(String deviceId, Long userId) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + deviceExpirationMs);

        return Jwts.builder()
                .subject("device:" + deviceId)
                .claim("deviceId", deviceId)
                .claim("userId", userId)
                .claim("type", TYPE_DEVICE)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(getSigningKey(), Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verified claims of a token.
     *
     * @throws io.jsonwebtoken.JwtException when the token is malformed, forged or expired
     */
    public Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    public String getUsernameFromToken(String token) {
        return parseClaims(token).getSubject();
    }

    public Long getUserIdFromToken(String token) {
        return parseClaims(token).get("userId", Long.class);
    }

    public String getRoleFromToken(String token) {
        return parseClaims(token).get("role", String.class);
    }

    public boolean validateToken(String authToken) {
        try {
            parseClaims(authToken);
            return true;
        } catch (Exception ex) {
            logger.warn("JWT validation error: {}", ex.getMessage());
        }
        return false;
    }

    public boolean isDeviceToken(Claims claims) {
        return TYPE_DEVICE.equals(claims.get("type", String.class));
    }
}
