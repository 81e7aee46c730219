package com.todo.service;

import com.todo.exception.RateLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RateLimitService.
 *
 * Tests the Redis counters including:
 * - Login failures keyed by email and ip
 * - TTL set only on the first hit of a window
 * - Password reset requests counted on every call
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitService Unit Tests")
class RateLimitServiceTest {

    @Mock
    private RedisTemplate<String, String> redisStringTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @InjectMocks
    private RateLimitService rateLimitService;

    private static final String LOGIN_KEY = "rate:login:jane@example.com|10.0.0.1";
    private static final String RESET_KEY = "rate:forgot:jane@example.com";

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(rateLimitService, "maxLoginAttempts", 5);
        ReflectionTestUtils.setField(rateLimitService, "loginWindowSeconds", 60L);
        ReflectionTestUtils.setField(rateLimitService, "maxResetRequests", 3);
        ReflectionTestUtils.setField(rateLimitService, "resetWindowSeconds", 3600L);
    }

    @Test
    @DisplayName("checkLogin should pass below the failure budget")
    void testCheckLogin_UnderLimit() {
        when(redisStringTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(LOGIN_KEY)).thenReturn("4");

        assertDoesNotThrow(() -> rateLimitService.checkLogin("Jane@Example.com", "10.0.0.1"));
    }

    @Test
    @DisplayName("checkLogin should report the remaining window once the budget is spent")
    void testCheckLogin_OverLimit() {
        // Arrange
        when(redisStringTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(LOGIN_KEY)).thenReturn("5");
        when(redisStringTemplate.getExpire(LOGIN_KEY, TimeUnit.SECONDS)).thenReturn(42L);

        // Act & Assert
        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> rateLimitService.checkLogin("jane@example.com", "10.0.0.1"));
        assertEquals(42L, ex.getRetryAfterSeconds());
        assertTrue(ex.getMessage().contains("42 seconds"));
    }

    @Test
    @DisplayName("recordLoginFailure should start the window on the first failure only")
    void testRecordLoginFailure_SetsTtlOnce() {
        when(redisStringTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment(LOGIN_KEY)).thenReturn(1L, 2L);

        rateLimitService.recordLoginFailure("jane@example.com", "10.0.0.1");
        rateLimitService.recordLoginFailure("jane@example.com", "10.0.0.1");

        verify(redisStringTemplate, times(1)).expire(LOGIN_KEY, 60L, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("clearLogin should drop the counter")
    void testClearLogin() {
        rateLimitService.clearLogin("jane@example.com", "10.0.0.1");

        verify(redisStringTemplate).delete(LOGIN_KEY);
    }

    @Test
    @DisplayName("consumePasswordReset should count the request when under the hourly budget")
    void testConsumePasswordReset_Counts() {
        when(redisStringTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(RESET_KEY)).thenReturn(null);
        when(valueOperations.increment(RESET_KEY)).thenReturn(1L);

        rateLimitService.consumePasswordReset("jane@example.com");

        verify(valueOperations).increment(RESET_KEY);
        verify(redisStringTemplate).expire(RESET_KEY, 3600L, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("consumePasswordReset should reject the fourth request and fall back to the window length")
    void testConsumePasswordReset_OverLimit() {
        when(redisStringTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(RESET_KEY)).thenReturn("3");
        when(redisStringTemplate.getExpire(RESET_KEY, TimeUnit.SECONDS)).thenReturn(-1L);

        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> rateLimitService.consumePasswordReset("jane@example.com"));
        assertEquals(3600L, ex.getRetryAfterSeconds());
        verify(valueOperations, never()).increment(anyString());
    }
}
