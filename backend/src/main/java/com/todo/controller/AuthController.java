package com.todo.controller;

import com.todo.dto.request.ChangePasswordRequest;
import com.todo.dto.request.ForgotPasswordRequest;
import com.todo.dto.request.LoginRequest;
import com.todo.dto.request.RegisterRequest;
import com.todo.dto.request.ResetPasswordRequest;
import com.todo.dto.request.UpdatePreferencesRequest;
import com.todo.dto.request.UpdateProfileRequest;
import com.todo.dto.response.ApiResponse;
import com.todo.dto.response.AuthResponse;
import com.todo.dto.response.DataExportResponse;
import com.todo.dto.response.PreferenceResponse;
import com.todo.dto.response.SessionResponse;
import com.todo.dto.response.UserResponse;
import com.todo.exception.RateLimitExceededException;
import com.todo.exception.ValidationException;
import com.todo.security.CurrentUser;
import com.todo.security.RequestMetadata;
import com.todo.service.AccountService;
import com.todo.service.AuthService;
import com.todo.service.PreferenceService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.MessageSourceAccessor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for authentication and account self-service.
 *
 * Public endpoints (no token): register, login, forgot-password, reset-password.
 * Every other endpoint requires a bearer token bound to an active session.
 *
 * Authentication Flow:
 * 1. Client registers or logs in with email and password
 * 2. Server opens a session and returns a JWT bound to it
 * 3. Client sends "Authorization: Bearer {token}" on later requests
 * 4. Logging out deactivates the session, which revokes the token
 *
 * Error Responses:
 * - 401 Unauthorized: Wrong credentials, deactivated account, missing or revoked token
 * - 404 Not Found: Session to revoke does not belong to the caller
 * - 422 Unprocessable Entity: Validation errors, keyed by field
 * - 429 Too Many Requests: Login or password reset rate limit exceeded
 *
 * All errors are handled by GlobalExceptionHandler and returned in RFC 7807 format.
 *
 * @see com.todo.service.AuthService
 * @see com.todo.config.SecurityConfig
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;
    private final AccountService accountService;
    private final PreferenceService preferenceService;
    private final MessageSourceAccessor messages;

    /**
     * Register a new account and sign it in.
     *
     * Endpoint: POST /api/auth/register
     * Authentication: None
     *
     * Example request:
     * <pre>
     * {
     *   "name": "Jane Doe",
     *   "email": "jane@example.com",
     *   "password": "secret123",
     *   "password_confirmation": "secret123"
     * }
     * </pre>
     *
     * Example response (201 Created):
     * <pre>
     * {
     *   "success": true,
     *   "message": "Registration successful",
     *   "data": {
     *     "user": { "id": "550e8400-e29b-41d4-a716-446655440000", "name": "Jane Doe", ... },
     *     "token": "eyJhbGciOiJIUzI1NiJ9...",
     *     "token_type": "Bearer",
     *     "expires_at": "2024-02-14T10:30:00"
     *   }
     * }
     * </pre>
     */
    @PostMapping("/register")
    public ResponseEntity<ApiResponse<AuthResponse>> register(
            @Valid @RequestBody RegisterRequest request,
            HttpServletRequest httpRequest) {

        log.info("Registration request received for email: {}", request.getEmail());

        try {
            AuthResponse auth = authService.register(request, RequestMetadata.from(httpRequest));
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApiResponse.ok(messages.getMessage("auth.registered"), auth));

        } catch (ValidationException e) {
            log.warn("Registration rejected for email: {} - {}", request.getEmail(), e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this

        } catch (Exception e) {
            log.error("Unexpected error during registration for email: {}", request.getEmail(), e);
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    /**
     * Log in with email and password.
     *
     * Endpoint: POST /api/auth/login
     * Authentication: None
     *
     * Failed attempts are limited to 5 per minute for each email and client
     * address; the sixth answers 429 with a Retry-After header.
     *
     * Example error response (wrong password):
     * <pre>
     * {
     *   "type": "https://api.todo.app/errors/unauthorized",
     *   "title": "Authentication Failed",
     *   "status": 401,
     *   "detail": "The provided credentials are incorrect.",
     *   "errors": { "email": ["The provided credentials are incorrect."] }
     * }
     * </pre>
     */
    @PostMapping("/login")
    public ResponseEntity<ApiResponse<AuthResponse>> login(
            @Valid @RequestBody LoginRequest request,
            HttpServletRequest httpRequest) {

        log.info("Login request received for email: {}", request.getEmail());

        try {
            AuthResponse auth = authService.login(request, RequestMetadata.from(httpRequest));
            return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("auth.logged_in"), auth));

        } catch (BadCredentialsException | DisabledException e) {
            log.warn("Login failed for email: {} - {}", request.getEmail(), e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this

        } catch (RateLimitExceededException e) {
            log.warn("Login rate limited for email: {}", request.getEmail());
            throw e;  // GlobalExceptionHandler will handle this

        } catch (Exception e) {
            log.error("Unexpected error during login for email: {}", request.getEmail(), e);
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    @PostMapping("/logout")
    public ResponseEntity<ApiResponse<Void>> logout(Authentication authentication) {
        authService.logout(authentication);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("auth.logged_out")));
    }

    @PostMapping("/logout-all")
    public ResponseEntity<ApiResponse<Void>> logoutAll(Authentication authentication) {
        int count = authService.logoutAll(authentication);
        log.info("User {} logged out of {} sessions", authentication.getName(), count);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("auth.logged_out_all")));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<UserResponse>> me(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(authService.me(authentication)));
    }

    @PutMapping("/profile")
    public ResponseEntity<ApiResponse<UserResponse>> updateProfile(
            Authentication authentication,
            @Valid @RequestBody UpdateProfileRequest request) {

        log.info("Profile update requested by user: {}", authentication.getName());
        UserResponse user = authService.updateProfile(authentication, request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("auth.profile_updated"), user));
    }

    /**
     * Update user preferences. Only known preference fields are applied; any
     * other property in the body is ignored.
     */
    @PutMapping("/preferences")
    public ResponseEntity<ApiResponse<PreferenceResponse>> updatePreferences(
            Authentication authentication,
            @Valid @RequestBody UpdatePreferencesRequest request) {

        PreferenceResponse preferences = preferenceService.updatePreferences(CurrentUser.userId(authentication), request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("auth.preferences_updated"), preferences));
    }

    @PutMapping("/change-password")
    public ResponseEntity<ApiResponse<Void>> changePassword(
            Authentication authentication,
            @Valid @RequestBody ChangePasswordRequest request) {

        log.info("Password change requested by user: {}", authentication.getName());

        try {
            authService.changePassword(authentication, request);
            return ResponseEntity.ok(ApiResponse.message(messages.getMessage("auth.password_changed")));

        } catch (ValidationException e) {
            log.warn("Password change rejected for user: {} - {}", authentication.getName(), e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    /**
     * Request a password reset link. Answers the same whether or not the email
     * is registered.
     */
    @PostMapping("/forgot-password")
    public ResponseEntity<ApiResponse<Void>> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.forgotPassword(request);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("auth.reset_link_sent")));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<ApiResponse<Void>> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        log.info("Password reset attempt for email: {}", request.getEmail());

        try {
            authService.resetPassword(request);
            return ResponseEntity.ok(ApiResponse.message(messages.getMessage("auth.password_reset")));

        } catch (ValidationException e) {
            log.warn("Password reset rejected for email: {} - {}", request.getEmail(), e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    @GetMapping("/sessions")
    public ResponseEntity<ApiResponse<List<SessionResponse>>> sessions(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(authService.sessions(authentication)));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<ApiResponse<Void>> revokeSession(
            Authentication authentication,
            @PathVariable UUID sessionId) {

        authService.revokeSession(authentication, sessionId);
        return ResponseEntity.ok(ApiResponse.message(messages.getMessage("auth.session_revoked")));
    }

    @PostMapping("/refresh")
    public ResponseEntity<ApiResponse<AuthResponse>> refresh(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("auth.token_refreshed"), authService.refresh(authentication)));
    }

    @GetMapping("/export-data")
    public ResponseEntity<ApiResponse<DataExportResponse>> exportData(Authentication authentication) {
        log.info("Data export requested by user: {}", authentication.getName());
        return ResponseEntity.ok(ApiResponse.ok(accountService.exportData(CurrentUser.userId(authentication))));
    }

    /**
     * Permanently delete the account and everything it owns.
     *
     * Endpoint: DELETE /api/auth/account
     * Authentication: Required (JWT token)
     */
    @DeleteMapping("/account")
    public ResponseEntity<ApiResponse<Void>> deleteAccount(Authentication authentication) {
        log.info("Account deletion requested by user: {}", authentication.getName());

        try {
            accountService.deleteAccount(CurrentUser.userId(authentication));
            return ResponseEntity.ok(ApiResponse.message(messages.getMessage("auth.account_deleted")));

        } catch (Exception e) {
            log.error("Unexpected error deleting account for user: {}", authentication.getName(), e);
            throw e;  // GlobalExceptionHandler will handle this
        }
    }
}
