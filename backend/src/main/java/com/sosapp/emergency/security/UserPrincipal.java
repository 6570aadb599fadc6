package com.sosapp.emergency.security;

import io.jsonwebtoken.Claims;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Authenticated user behind a bearer token. Owners and contacts are both plain users;
 * which one a caller is depends on the emergency being accessed.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class UserPrincipal {

    static final String DEFAULT_ROLE = "USER";

    private final Long userId;
    private final String username;
    private final String role;

    static UserPrincipal fromClaims(Claims claims) {
        String role = claims.get("role", String.class);
        return new UserPrincipal(claims.get("userId", Long.class), claims.getSubject(),
                role != null ? role : DEFAULT_ROLE);
    }

    SimpleGrantedAuthority authority() {
        return new SimpleGrantedAuthority("ROLE_" + role);
    }
}
