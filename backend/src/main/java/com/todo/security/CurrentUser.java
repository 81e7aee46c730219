package com.todo.security;

import com.todo.exception.UnauthorizedException;
import org.springframework.security.core.Authentication;

import java.util.UUID;

/**
 * Reads the caller's identity out of the {@link Authentication} built by
 * {@link JwtTokenProvider#getAuthentication(String)}.
 */
public final class CurrentUser {

    private CurrentUser() {
    }

    /**
     * @throws UnauthorizedException if the authentication does not name a user id
     */
    public static UUID userId(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new UnauthorizedException("Authentication is required.");
        }
        try {
            return UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException ex) {
            throw new UnauthorizedException("Invalid authentication principal.", ex);
        }
    }

    /**
     * @return the session id bound to the token, or null when it carries none
     */
    public static UUID sessionId(Authentication authentication) {
        if (authentication != null && authentication.getDetails() instanceof TokenDetails) {
            return ((TokenDetails) authentication.getDetails()).getSessionId();
        }
        return null;
    }
}
