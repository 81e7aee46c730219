package com.todo.service;

import com.todo.dto.request.ChangePasswordRequest;
import com.todo.dto.request.ForgotPasswordRequest;
import com.todo.dto.request.LoginRequest;
import com.todo.dto.request.RegisterRequest;
import com.todo.dto.request.ResetPasswordRequest;
import com.todo.dto.request.UpdateProfileRequest;
import com.todo.dto.response.AuthResponse;
import com.todo.dto.response.SessionResponse;
import com.todo.dto.response.UserResponse;
import com.todo.entity.PasswordResetToken;
import com.todo.entity.User;
import com.todo.entity.UserPreference;
import com.todo.entity.UserSession;
import com.todo.exception.ResourceNotFoundException;
import com.todo.exception.UnauthorizedException;
import com.todo.exception.ValidationException;
import com.todo.repository.PasswordResetTokenRepository;
import com.todo.repository.UserRepository;
import com.todo.security.CurrentUser;
import com.todo.security.JwtTokenProvider;
import com.todo.security.RequestMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.core.Authentication;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Service for account authentication and self-service.
 *
 * Authentication Flow:
 * 1. User registers or logs in with email and password
 * 2. A {@link UserSession} is opened, recording the client's ip and user agent
 * 3. A JWT bound to that session is issued
 * 4. Logout, password change and password reset deactivate sessions, which
 *    revokes their tokens immediately
 *
 * Security Features:
 * - Passwords stored as BCrypt hashes
 * - Failed logins rate limited per email and ip (Redis, see {@link RateLimitService})
 * - Password reset tokens are random, stored hashed, single-use and short-lived
 * - Forgot-password never reveals whether an email is registered
 *
 * @see com.todo.security.JwtTokenProvider
 * @see SessionService
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuthService {

    static final String BAD_CREDENTIALS = "The provided credentials are incorrect.";
    static final String ACCOUNT_DISABLED = "Your account has been deactivated.";
    static final String INVALID_RESET_TOKEN = "validation.token.invalid";
    static final String PASSWORD_MISMATCH = "validation.password.confirmed";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final UserRepository userRepository;
    private final PasswordResetTokenRepository resetTokenRepository;
    private final PreferenceService preferenceService;
    private final SessionService sessionService;
    private final RateLimitService rateLimitService;
    private final MailService mailService;
    private final JwtTokenProvider jwtTokenProvider;
    private final PasswordEncoder passwordEncoder;

    @Value("${app.auth.password-reset.token-lifetime-minutes:60}")
    private long resetTokenLifetimeMinutes;

    /**
     * Create an account with default preferences and sign it in.
     *
     * @throws ValidationException if the email is taken, the passwords differ or the timezone is unknown
     */
    @Transactional
    public AuthResponse register(RegisterRequest request, RequestMetadata metadata) {
        String email = normalizeEmail(request.getEmail());
        log.info("Registration requested for email: {}", email);

        requireConfirmed(request.getPassword(), request.getPasswordConfirmation());
        if (userRepository.existsByEmail(email)) {
            throw ValidationException.of("email", "validation.email.unique");
        }

        User user = new User(request.getName().trim(), email, passwordEncoder.encode(request.getPassword()));
        if (request.getTimezone() != null) {
            user.setTimezone(requireZone(request.getTimezone()));
        }
        if (request.getLocale() != null) {
            user.setLocale(request.getLocale().toLowerCase(Locale.ROOT));
        }
        user.setLastLoginAt(LocalDateTime.now());
        user = userRepository.save(user);

        UserPreference preference = preferenceService.getOrCreate(user);
        UserSession session = sessionService.open(user, metadata);

        log.info("User registered: {} ({})", user.getId(), email);
        return issue(user, preference, session);
    }

    /**
     * Authenticate with email and password.
     *
     * @throws com.todo.exception.RateLimitExceededException if the failure budget is spent
     * @throws BadCredentialsException if the email is unknown or the password wrong
     * @throws DisabledException if the account is deactivated
     */
    @Transactional
    public AuthResponse login(LoginRequest request, RequestMetadata metadata) {
        String email = normalizeEmail(request.getEmail());
        String ip = metadata.getIpAddress();

        rateLimitService.checkLogin(email, ip);

        User user = userRepository.findByEmail(email).orElse(null);
        if (user == null) {
            rateLimitService.recordLoginFailure(email, ip);
            log.warn("Login failed: unknown email {}", email);
            throw new BadCredentialsException(BAD_CREDENTIALS);
        }
        if (!Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("Login rejected for deactivated user {}", user.getId());
            throw new DisabledException(ACCOUNT_DISABLED);
        }
        if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            rateLimitService.recordLoginFailure(email, ip);
            log.warn("Login failed: wrong password for user {}", user.getId());
            throw new BadCredentialsException(BAD_CREDENTIALS);
        }

        rateLimitService.clearLogin(email, ip);
        user.setLastLoginAt(LocalDateTime.now());
        user = userRepository.save(user);

        UserSession session = sessionService.open(user, metadata);
        log.info("User logged in: {}", user.getId());
        return issue(user, preferenceService.getOrCreate(user), session);
    }

    public void logout(Authentication authentication) {
        sessionService.deactivate(CurrentUser.sessionId(authentication));
        log.info("User logged out: {}", authentication.getName());
    }

    public int logoutAll(Authentication authentication) {
        return sessionService.deactivateAll(CurrentUser.userId(authentication));
    }

    @Transactional
    public UserResponse me(Authentication authentication) {
        User user = loadUser(CurrentUser.userId(authentication));
        return UserResponse.from(user, preferenceService.getOrCreate(user));
    }

    /**
     * Partial profile update; null fields are left unchanged.
     *
     * @throws ValidationException if the new email belongs to another account or the timezone is unknown
     */
    @Transactional
    public UserResponse updateProfile(Authentication authentication, UpdateProfileRequest request) {
        User user = loadUser(CurrentUser.userId(authentication));

        if (request.getEmail() != null) {
            String email = normalizeEmail(request.getEmail());
            if (userRepository.existsByEmailAndIdNot(email, user.getId())) {
                throw ValidationException.of("email", "validation.email.unique");
            }
            user.setEmail(email);
        }
        if (request.getName() != null) {
            user.setName(request.getName().trim());
        }
        if (request.getTimezone() != null) {
            user.setTimezone(requireZone(request.getTimezone()));
        }
        if (request.getLocale() != null) {
            user.setLocale(request.getLocale().toLowerCase(Locale.ROOT));
        }
        if (request.getAvatarUrl() != null) {
            user.setAvatarUrl(request.getAvatarUrl().isBlank() ? null : request.getAvatarUrl());
        }

        user = userRepository.save(user);
        log.info("Profile updated for user {}", user.getId());
        return UserResponse.from(user, preferenceService.getOrCreate(user));
    }

    /**
     * Change the password and sign out every other session.
     *
     * @throws ValidationException if the current password is wrong or the confirmation differs
     */
    @Transactional
    public void changePassword(Authentication authentication, ChangePasswordRequest request) {
        User user = loadUser(CurrentUser.userId(authentication));

        if (!passwordEncoder.matches(request.getCurrentPassword(), user.getPasswordHash())) {
            throw ValidationException.of("current_password", "validation.current_password.incorrect");
        }
        requireConfirmed(request.getPassword(), request.getPasswordConfirmation());

        user.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        userRepository.save(user);
        sessionService.deactivateOthers(user.getId(), CurrentUser.sessionId(authentication));

        log.info("Password changed for user {}", user.getId());
        mailService.sendPasswordChanged(user);
    }

    /**
     * Email a reset link when the address is registered. Answers the same way
     * either way.
     *
     * @throws com.todo.exception.RateLimitExceededException after three requests in an hour
     */
    @Transactional
    public void forgotPassword(ForgotPasswordRequest request) {
        String email = normalizeEmail(request.getEmail());
        rateLimitService.consumePasswordReset(email);

        User user = userRepository.findByEmail(email).orElse(null);
        if (user == null) {
            log.info("Password reset requested for unknown email");
            return;
        }

        resetTokenRepository.markAllUsedByEmail(email);
        String plainToken = generateResetToken();
        resetTokenRepository.save(new PasswordResetToken(
                email, hashToken(plainToken), LocalDateTime.now().plusMinutes(resetTokenLifetimeMinutes)));

        mailService.sendPasswordReset(user, plainToken);
        log.info("Password reset token issued for user {}", user.getId());
    }

    /**
     * Redeem a reset token: set the password and sign out everywhere.
     *
     * @throws ValidationException if the token is unknown, used, expired or for another email
     */
    @Transactional
    public void resetPassword(ResetPasswordRequest request) {
        String email = normalizeEmail(request.getEmail());
        requireConfirmed(request.getPassword(), request.getPasswordConfirmation());

        PasswordResetToken token = resetTokenRepository.findByEmailAndTokenHash(email, hashToken(request.getToken()))
                .filter(t -> t.isRedeemableAt(LocalDateTime.now()))
                .orElseThrow(() -> ValidationException.of("token", INVALID_RESET_TOKEN));
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> ValidationException.of("token", INVALID_RESET_TOKEN));

        user.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        userRepository.save(user);
        token.setUsed(true);
        resetTokenRepository.save(token);
        sessionService.deactivateAll(user.getId());

        log.info("Password reset completed for user {}", user.getId());
        mailService.sendPasswordChanged(user);
    }

    public List<SessionResponse> sessions(Authentication authentication) {
        return sessionService.listActive(CurrentUser.userId(authentication), CurrentUser.sessionId(authentication));
    }

    public void revokeSession(Authentication authentication, UUID sessionId) {
        sessionService.revoke(CurrentUser.userId(authentication), sessionId);
    }

    /**
     * Issue a fresh token for the current session and extend the session.
     */
    @Transactional
    public AuthResponse refresh(Authentication authentication) {
        UUID sessionId = CurrentUser.sessionId(authentication);
        if (sessionId == null) {
            throw new UnauthorizedException("Token is not bound to a session.");
        }
        User user = loadUser(CurrentUser.userId(authentication));
        UserSession session = sessionService.extend(user.getId(), sessionId);
        log.info("Token refreshed for user {} (session {})", user.getId(), sessionId);
        return issue(user, preferenceService.getOrCreate(user), session);
    }

    private AuthResponse issue(User user, UserPreference preference, UserSession session) {
        return AuthResponse.builder()
                .user(UserResponse.from(user, preference))
                .token(jwtTokenProvider.generateToken(user.getId(), user.getEmail(), session.getId()))
                .expiresAt(session.getExpiresAt())
                .build();
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
    }

    private void requireConfirmed(String password, String confirmation) {
        if (confirmation == null || !confirmation.equals(password)) {
            throw ValidationException.of("password", PASSWORD_MISMATCH);
        }
    }

    private String requireZone(String timezone) {
        try {
            return ZoneId.of(timezone.trim()).getId();
        } catch (DateTimeException e) {
            throw ValidationException.of("timezone", "validation.timezone.invalid");
        }
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    static String generateResetToken() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    static String hashToken(String plainToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(plainToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
