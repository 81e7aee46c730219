package com.todo.service;

import com.todo.dto.request.ChangePasswordRequest;
import com.todo.dto.request.ForgotPasswordRequest;
import com.todo.dto.request.LoginRequest;
import com.todo.dto.request.RegisterRequest;
import com.todo.dto.request.ResetPasswordRequest;
import com.todo.dto.response.AuthResponse;
import com.todo.entity.PasswordResetToken;
import com.todo.entity.User;
import com.todo.entity.UserPreference;
import com.todo.entity.UserSession;
import com.todo.exception.RateLimitExceededException;
import com.todo.exception.ValidationException;
import com.todo.repository.PasswordResetTokenRepository;
import com.todo.repository.UserRepository;
import com.todo.security.JwtTokenProvider;
import com.todo.security.RequestMetadata;
import com.todo.security.TokenDetails;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthService.
 *
 * Tests the business logic for authentication including:
 * - Registration with password confirmation and unique email
 * - Login with rate limiting and deactivated accounts
 * - Password change and reset token redemption
 * - Forgot-password answering the same way for unknown emails
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService Unit Tests")
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordResetTokenRepository resetTokenRepository;

    @Mock
    private PreferenceService preferenceService;

    @Mock
    private SessionService sessionService;

    @Mock
    private RateLimitService rateLimitService;

    @Mock
    private MailService mailService;

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private AuthService authService;

    private User testUser;
    private UUID testUserId;
    private UserSession testSession;
    private RequestMetadata metadata;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(authService, "resetTokenLifetimeMinutes", 60L);

        testUserId = UUID.randomUUID();
        testUser = new User("Jane Doe", "jane@example.com", "hashed");
        testUser.setId(testUserId);

        testSession = new UserSession();
        testSession.setId(UUID.randomUUID());
        testSession.setUser(testUser);
        testSession.setIsActive(true);
        testSession.setExpiresAt(LocalDateTime.now().plusDays(30));

        metadata = new RequestMetadata("10.0.0.1", "Mozilla/5.0 (Windows NT 10.0) Chrome/120.0");
    }

    private UsernamePasswordAuthenticationToken authentication(UUID sessionId) {
        UsernamePasswordAuthenticationToken auth =
                new UsernamePasswordAuthenticationToken(testUserId.toString(), null, List.of());
        auth.setDetails(new TokenDetails(testUser.getEmail(), sessionId));
        return auth;
    }

    @Test
    @DisplayName("register should normalize the email and issue a session-bound token")
    void testRegister_Success() {
        // Arrange
        RegisterRequest request = RegisterRequest.builder()
                .name("  Jane Doe ")
                .email("  Jane@Example.COM ")
                .password("secret123")
                .passwordConfirmation("secret123")
                .timezone("Europe/Berlin")
                .build();

        when(userRepository.existsByEmail("jane@example.com")).thenReturn(false);
        when(passwordEncoder.encode("secret123")).thenReturn("hashed");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User saved = invocation.getArgument(0);
            saved.setId(testUserId);
            return saved;
        });
        when(preferenceService.getOrCreate(any(User.class))).thenAnswer(inv -> new UserPreference(inv.getArgument(0)));
        when(sessionService.open(any(User.class), eq(metadata))).thenReturn(testSession);
        when(jwtTokenProvider.generateToken(testUserId, "jane@example.com", testSession.getId())).thenReturn("jwt.token.here");

        // Act
        AuthResponse response = authService.register(request, metadata);

        // Assert
        assertEquals("jwt.token.here", response.getToken());
        assertEquals("Bearer", response.getTokenType());
        assertEquals("jane@example.com", response.getUser().getEmail());
        assertEquals("Jane Doe", response.getUser().getName());
        assertEquals("Europe/Berlin", response.getUser().getTimezone());
        assertEquals(testSession.getExpiresAt(), response.getExpiresAt());
    }

    @Test
    @DisplayName("register should reject a taken email")
    void testRegister_DuplicateEmail() {
        // Arrange
        RegisterRequest request = RegisterRequest.builder()
                .name("Jane").email("jane@example.com")
                .password("secret123").passwordConfirmation("secret123")
                .build();
        when(userRepository.existsByEmail("jane@example.com")).thenReturn(true);

        // Act & Assert
        ValidationException ex = assertThrows(ValidationException.class, () -> authService.register(request, metadata));
        assertTrue(ex.getErrors().containsKey("email"));
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("register should reject a mismatched confirmation and an unknown timezone")
    void testRegister_InvalidInput() {
        RegisterRequest mismatch = RegisterRequest.builder()
                .name("Jane").email("jane@example.com")
                .password("secret123").passwordConfirmation("secret124")
                .build();
        ValidationException ex = assertThrows(ValidationException.class, () -> authService.register(mismatch, metadata));
        assertEquals(List.of(AuthService.PASSWORD_MISMATCH), ex.getErrors().get("password"));

        RegisterRequest badZone = RegisterRequest.builder()
                .name("Jane").email("jane@example.com")
                .password("secret123").passwordConfirmation("secret123")
                .timezone("Mars/Olympus")
                .build();
        when(userRepository.existsByEmail(anyString())).thenReturn(false);
        when(passwordEncoder.encode(anyString())).thenReturn("hashed");
        ex = assertThrows(ValidationException.class, () -> authService.register(badZone, metadata));
        assertTrue(ex.getErrors().containsKey("timezone"));
    }

    @Test
    @DisplayName("login should clear the failure counter and open a session on success")
    void testLogin_Success() {
        // Arrange
        when(userRepository.findByEmail("jane@example.com")).thenReturn(Optional.of(testUser));
        when(passwordEncoder.matches("secret123", "hashed")).thenReturn(true);
        when(userRepository.save(testUser)).thenReturn(testUser);
        when(sessionService.open(testUser, metadata)).thenReturn(testSession);
        when(preferenceService.getOrCreate(testUser)).thenReturn(new UserPreference(testUser));
        when(jwtTokenProvider.generateToken(testUserId, "jane@example.com", testSession.getId())).thenReturn("jwt");

        // Act
        AuthResponse response = authService.login(new LoginRequest("JANE@example.com", "secret123"), metadata);

        // Assert
        assertEquals("jwt", response.getToken());
        assertNotNull(testUser.getLastLoginAt());
        verify(rateLimitService).checkLogin("jane@example.com", "10.0.0.1");
        verify(rateLimitService).clearLogin("jane@example.com", "10.0.0.1");
        verify(rateLimitService, never()).recordLoginFailure(anyString(), anyString());
    }

    @Test
    @DisplayName("login should record a failure for a wrong password")
    void testLogin_WrongPassword() {
        // Arrange
        when(userRepository.findByEmail("jane@example.com")).thenReturn(Optional.of(testUser));
        when(passwordEncoder.matches("wrong", "hashed")).thenReturn(false);

        // Act & Assert
        BadCredentialsException ex = assertThrows(BadCredentialsException.class,
                () -> authService.login(new LoginRequest("jane@example.com", "wrong"), metadata));
        assertEquals(AuthService.BAD_CREDENTIALS, ex.getMessage());
        verify(rateLimitService).recordLoginFailure("jane@example.com", "10.0.0.1");
        verify(sessionService, never()).open(any(), any());
    }

    @Test
    @DisplayName("login should give the same answer for an unknown email")
    void testLogin_UnknownEmail() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        BadCredentialsException ex = assertThrows(BadCredentialsException.class,
                () -> authService.login(new LoginRequest("ghost@example.com", "whatever"), metadata));
        assertEquals(AuthService.BAD_CREDENTIALS, ex.getMessage());
        verify(rateLimitService).recordLoginFailure("ghost@example.com", "10.0.0.1");
    }

    @Test
    @DisplayName("login should refuse a deactivated account")
    void testLogin_Deactivated() {
        testUser.setIsActive(false);
        when(userRepository.findByEmail("jane@example.com")).thenReturn(Optional.of(testUser));

        assertThrows(DisabledException.class,
                () -> authService.login(new LoginRequest("jane@example.com", "secret123"), metadata));
        verify(sessionService, never()).open(any(), any());
    }

    @Test
    @DisplayName("login should stop before any lookup when rate limited")
    void testLogin_RateLimited() {
        doThrow(new RateLimitExceededException("auth.too_many_logins", "Too many login attempts.", 42))
                .when(rateLimitService).checkLogin("jane@example.com", "10.0.0.1");

        assertThrows(RateLimitExceededException.class,
                () -> authService.login(new LoginRequest("jane@example.com", "secret123"), metadata));
        verify(userRepository, never()).findByEmail(anyString());
    }

    @Test
    @DisplayName("changePassword should keep only the current session")
    void testChangePassword_Success() {
        // Arrange
        UUID sessionId = testSession.getId();
        when(userRepository.findById(testUserId)).thenReturn(Optional.of(testUser));
        when(passwordEncoder.matches("old-secret", "hashed")).thenReturn(true);
        when(passwordEncoder.encode("new-secret")).thenReturn("new-hash");

        // Act
        authService.changePassword(authentication(sessionId),
                new ChangePasswordRequest("old-secret", "new-secret", "new-secret"));

        // Assert
        assertEquals("new-hash", testUser.getPasswordHash());
        verify(sessionService).deactivateOthers(testUserId, sessionId);
        verify(mailService).sendPasswordChanged(testUser);
    }

    @Test
    @DisplayName("changePassword should reject a wrong current password")
    void testChangePassword_WrongCurrent() {
        when(userRepository.findById(testUserId)).thenReturn(Optional.of(testUser));
        when(passwordEncoder.matches("bad", "hashed")).thenReturn(false);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> authService.changePassword(authentication(null),
                        new ChangePasswordRequest("bad", "new-secret", "new-secret")));
        assertTrue(ex.getErrors().containsKey("current_password"));
        verify(sessionService, never()).deactivateOthers(any(), any());
    }

    @Test
    @DisplayName("forgotPassword should store only the token hash and mail the plain token")
    void testForgotPassword_KnownEmail() {
        // Arrange
        when(userRepository.findByEmail("jane@example.com")).thenReturn(Optional.of(testUser));

        // Act
        authService.forgotPassword(new ForgotPasswordRequest("Jane@Example.com"));

        // Assert
        ArgumentCaptor<PasswordResetToken> tokenCaptor = ArgumentCaptor.forClass(PasswordResetToken.class);
        ArgumentCaptor<String> plainCaptor = ArgumentCaptor.forClass(String.class);
        verify(rateLimitService).consumePasswordReset("jane@example.com");
        verify(resetTokenRepository).markAllUsedByEmail("jane@example.com");
        verify(resetTokenRepository).save(tokenCaptor.capture());
        verify(mailService).sendPasswordReset(eq(testUser), plainCaptor.capture());

        String plain = plainCaptor.getValue();
        assertEquals(64, plain.length());
        assertEquals(AuthService.hashToken(plain), tokenCaptor.getValue().getTokenHash());
        assertNotEquals(plain, tokenCaptor.getValue().getTokenHash());
    }

    @Test
    @DisplayName("forgotPassword should silently do nothing for an unknown email")
    void testForgotPassword_UnknownEmail() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertDoesNotThrow(() -> authService.forgotPassword(new ForgotPasswordRequest("ghost@example.com")));
        verify(resetTokenRepository, never()).save(any());
        verify(mailService, never()).sendPasswordReset(any(), anyString());
    }

    @Test
    @DisplayName("resetPassword should set the password, burn the token and end every session")
    void testResetPassword_Success() {
        // Arrange
        String plain = "abc123";
        PasswordResetToken token = new PasswordResetToken(
                "jane@example.com", AuthService.hashToken(plain), LocalDateTime.now().plusMinutes(30));
        when(resetTokenRepository.findByEmailAndTokenHash("jane@example.com", AuthService.hashToken(plain)))
                .thenReturn(Optional.of(token));
        when(userRepository.findByEmail("jane@example.com")).thenReturn(Optional.of(testUser));
        when(passwordEncoder.encode("brand-new-pass")).thenReturn("new-hash");

        // Act
        authService.resetPassword(new ResetPasswordRequest(plain, "jane@example.com", "brand-new-pass", "brand-new-pass"));

        // Assert
        assertEquals("new-hash", testUser.getPasswordHash());
        assertTrue(token.getUsed());
        verify(sessionService).deactivateAll(testUserId);
    }

    @Test
    @DisplayName("resetPassword should reject an expired token")
    void testResetPassword_Expired() {
        String plain = "abc123";
        PasswordResetToken token = new PasswordResetToken(
                "jane@example.com", AuthService.hashToken(plain), LocalDateTime.now().minusMinutes(1));
        when(resetTokenRepository.findByEmailAndTokenHash("jane@example.com", AuthService.hashToken(plain)))
                .thenReturn(Optional.of(token));

        ValidationException ex = assertThrows(ValidationException.class, () -> authService.resetPassword(
                new ResetPasswordRequest(plain, "jane@example.com", "brand-new-pass", "brand-new-pass")));
        assertEquals(List.of(AuthService.INVALID_RESET_TOKEN), ex.getErrors().get("token"));
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("refresh should extend the current session and issue a new token")
    void testRefresh_Success() {
        when(userRepository.findById(testUserId)).thenReturn(Optional.of(testUser));
        when(sessionService.extend(testUserId, testSession.getId())).thenReturn(testSession);
        when(preferenceService.getOrCreate(testUser)).thenReturn(new UserPreference(testUser));
        when(jwtTokenProvider.generateToken(testUserId, "jane@example.com", testSession.getId())).thenReturn("fresh");

        AuthResponse response = authService.refresh(authentication(testSession.getId()));

        assertEquals("fresh", response.getToken());
        assertEquals(testSession.getExpiresAt(), response.getExpiresAt());
    }

    @Test
    @DisplayName("hashToken should be a stable hex digest")
    void testHashToken() {
        assertEquals(AuthService.hashToken("value"), AuthService.hashToken("value"));
        assertEquals(64, AuthService.hashToken("value").length());
        assertNotEquals(AuthService.hashToken("value"), AuthService.hashToken("other"));
    }
}
