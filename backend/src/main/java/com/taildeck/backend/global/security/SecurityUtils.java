package com.taildeck.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.taildeck.backend.global.error.AuthenticationRequiredException;
import com.taildeck.backend.modules.auth.application.SessionClaims;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<SessionClaims> currentClaims() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof SessionClaims claims) {
            return Optional.of(claims);
        }
        return Optional.empty();
    }

    public static SessionClaims getCurrentClaims() {
        return currentClaims().orElseThrow(AuthenticationRequiredException::new);
    }

    public static UUID getCurrentUserId() {
        return getCurrentClaims().userId();
    }
}
