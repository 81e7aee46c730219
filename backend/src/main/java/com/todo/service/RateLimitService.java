package com.todo.service;

import com.todo.exception.RateLimitExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window attempt counters kept in Redis.
 *
 * Each counter is a string key holding an integer. The first hit of a window
 * sets the key's TTL to the window length, so the counter disappears (and the
 * budget is restored) when the window ends.
 *
 * Redis Key Structure:
 * - Login failures: "rate:login:{email}|{ip}" → failed attempts in the last minute
 * - Password reset requests: "rate:forgot:{email}" → requests in the last hour
 *
 * Login counts only failed attempts and is cleared on success; password reset
 * counts every request, whether or not the email exists.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RateLimitService {

    private final RedisTemplate<String, String> redisStringTemplate;

    @Value("${app.auth.login.max-attempts:5}")
    private int maxLoginAttempts;

    @Value("${app.auth.login.window-seconds:60}")
    private long loginWindowSeconds;

    @Value("${app.auth.password-reset.max-requests:3}")
    private int maxResetRequests;

    @Value("${app.auth.password-reset.window-seconds:3600}")
    private long resetWindowSeconds;

    private static final String LOGIN_KEY_PREFIX = "rate:login:";
    private static final String RESET_KEY_PREFIX = "rate:forgot:";

    /**
     * Rejects the login when the email/ip pair has used up its failure budget.
     *
     * @throws RateLimitExceededException with the seconds until the window ends
     */
    public void checkLogin(String email, String ipAddress) {
        String key = loginKey(email, ipAddress);
        if (currentCount(key) >= maxLoginAttempts) {
            long seconds = secondsRemaining(key, loginWindowSeconds);
            log.warn("Login rate limit exceeded for email: {} from ip: {}", email, ipAddress);
            throw new RateLimitExceededException("auth.too_many_logins",
                    "Too many login attempts. Please try again in " + seconds + " seconds.", seconds);
        }
    }

    public void recordLoginFailure(String email, String ipAddress) {
        long count = hit(loginKey(email, ipAddress), loginWindowSeconds);
        log.debug("Failed login recorded for email: {} ({}/{})", email, count, maxLoginAttempts);
    }

    public void clearLogin(String email, String ipAddress) {
        redisStringTemplate.delete(loginKey(email, ipAddress));
    }

    /**
     * Counts a password reset request, rejecting it when the hourly budget is spent.
     *
     * @throws RateLimitExceededException with the seconds until the window ends
     */
    public void consumePasswordReset(String email) {
        String key = RESET_KEY_PREFIX + normalize(email);
        if (currentCount(key) >= maxResetRequests) {
            long seconds = secondsRemaining(key, resetWindowSeconds);
            log.warn("Password reset rate limit exceeded for email: {}", email);
            throw new RateLimitExceededException("auth.too_many_resets",
                    "Too many password reset requests. Please try again in " + seconds + " seconds.", seconds);
        }
        hit(key, resetWindowSeconds);
    }

    private long hit(String key, long windowSeconds) {
        Long count = redisStringTemplate.opsForValue().increment(key);
        if (count != null && count == 1L) {
            redisStringTemplate.expire(key, windowSeconds, TimeUnit.SECONDS);
        }
        return count != null ? count : 0L;
    }

    private long currentCount(String key) {
        String value = redisStringTemplate.opsForValue().get(key);
        return value != null ? Long.parseLong(value) : 0L;
    }

    private long secondsRemaining(String key, long fallback) {
        Long ttl = redisStringTemplate.getExpire(key, TimeUnit.SECONDS);
        return ttl != null && ttl > 0 ? ttl : fallback;
    }

    private String loginKey(String email, String ipAddress) {
        return LOGIN_KEY_PREFIX + normalize(email) + "|" + ipAddress;
    }

    private String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
