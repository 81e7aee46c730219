package com.todo.security;

import com.todo.service.SessionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * JWT Authentication Filter for request validation.
 *
 * Filter Execution Flow:
 * 1. Extract JWT token from Authorization header (Bearer {token})
 * 2. Validate token signature and expiration
 * 3. Check that the session named by the {@code sid} claim is still active and
 *    unexpired, and record the request as session activity
 * 4. If all checks pass, set the Authentication in the SecurityContext
 * 5. Pass request to next filter in chain
 *
 * Requests without a usable token pass through unauthenticated; SecurityConfig
 * decides whether the endpoint needs authentication.
 *
 * @see JwtTokenProvider
 * @see SessionService
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenProvider jwtTokenProvider;
    private final SessionService sessionService;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader("Authorization"));

            if (token != null && jwtTokenProvider.validateToken(token)) {
                UUID sessionId = jwtTokenProvider.getSessionIdFromToken(token);

                if (sessionId != null && sessionService.touchIfUsable(sessionId)) {
                    Authentication authentication = jwtTokenProvider.getAuthentication(token);
                    SecurityContextHolder.getContext().setAuthentication(authentication);

                    log.debug("Set authentication for user: {} on path: {}",
                            authentication.getPrincipal(),
                            request.getRequestURI());
                } else {
                    log.warn("Token for revoked or expired session on path: {}", request.getRequestURI());
                }
            } else if (token != null) {
                log.warn("Invalid JWT token on path: {}", request.getRequestURI());
            }
        } catch (Exception ex) {
            // SecurityContext stays empty; SecurityConfig answers 401 for protected paths
            log.error("Cannot set user authentication: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/error");
    }
}
