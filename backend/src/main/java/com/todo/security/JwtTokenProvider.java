package com.todo.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;
import java.util.UUID;

/**
 * JWT Token Provider for generating and validating bearer tokens.
 *
 * Every token is bound to a {@link com.todo.entity.UserSession}: besides the
 * user id (subject) and email it carries the session id in the {@code sid}
 * claim. A token whose signature and expiry are valid is still rejected by
 * {@link JwtAuthenticationFilter} once its session has been deactivated.
 *
 * Security Features:
 * - Tokens signed with secret key (HS256)
 * - Configurable expiration time (defaults to the session lifetime)
 * - Validation of token signature, expiration, and malformation
 *
 * @see io.jsonwebtoken.Jwts
 * @see TokenDetails
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String EMAIL_CLAIM = "email";
    static final String SESSION_CLAIM = "sid";

    @Value("${jwt.secret}")
    private String jwtSecret;

    @Value("${jwt.expiration}")
    private long jwtExpirationMs;

    private SecretKey secretKey;

    /**
     * Initialize the secret key after properties are injected.
     */
    @PostConstruct
    public void init() {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT Token Provider initialized with expiration: {} ms", jwtExpirationMs);
    }

    /**
     * Generate a token for a user session.
     *
     * The token contains the following claims:
     * - sub: User ID (UUID)
     * - email: User email address
     * - sid: Session ID (UUID)
     * - iat / exp: issue and expiry timestamps
     *
     * @param userId the user's unique identifier
     * @param email the user's email address
     * @param sessionId the session the token is bound to
     * @return JWT token string
     */
    public String generateToken(UUID userId, String email, UUID sessionId) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        String token = Jwts.builder()
                .subject(userId.toString())
                .claim(EMAIL_CLAIM, email)
                .claim(SESSION_CLAIM, sessionId.toString())
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated JWT token for user: {} (session: {})", userId, sessionId);
        return token;
    }

    /**
     * Validate JWT token signature, expiration, and structure.
     *
     * @param token the JWT token to validate
     * @return true if token is valid, false otherwise
     */
    public boolean validateToken(String token) {
        try {
            parseClaims(token);
            return true;
        } catch (SecurityException ex) {
            log.error("Invalid JWT signature: {}", ex.getMessage());
        } catch (MalformedJwtException ex) {
            log.error("Invalid JWT token: {}", ex.getMessage());
        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
        } catch (UnsupportedJwtException ex) {
            log.error("Unsupported JWT token: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.error("JWT claims string is empty: {}", ex.getMessage());
        }
        return false;
    }

    public UUID getUserIdFromToken(String token) {
        return UUID.fromString(parseClaims(token).getSubject());
    }

    public String getEmailFromToken(String token) {
        return parseClaims(token).get(EMAIL_CLAIM, String.class);
    }

    /**
     * @return the session id, or null for a token issued without one
     */
    public UUID getSessionIdFromToken(String token) {
        String sid = parseClaims(token).get(SESSION_CLAIM, String.class);
        return sid != null ? UUID.fromString(sid) : null;
    }

    /**
     * Get Authentication object from JWT token.
     *
     * The principal is the user id as a string; the details are a
     * {@link TokenDetails} with the email and session id.
     *
     * @param token the JWT token
     * @return Authentication object with user details
     */
    public Authentication getAuthentication(String token) {
        Claims claims = parseClaims(token);
        String sid = claims.get(SESSION_CLAIM, String.class);

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(
                        claims.getSubject(),
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER"))
                );

        authentication.setDetails(new TokenDetails(
                claims.get(EMAIL_CLAIM, String.class),
                sid != null ? UUID.fromString(sid) : null
        ));
        return authentication;
    }

    /**
     * Extract JWT token from Authorization header.
     *
     * Expected header format: "Bearer {token}"
     *
     * @param bearerToken the Authorization header value
     * @return the JWT token string, or null if header is invalid
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    public long getExpirationMs() {
        return jwtExpirationMs;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
