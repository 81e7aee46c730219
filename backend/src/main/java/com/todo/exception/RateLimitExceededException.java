package com.todo.exception;

/**
 * Thrown when a caller exceeds an attempt budget (login, password reset).
 * Mapped to HTTP 429 with a {@code Retry-After} header.
 */
public class RateLimitExceededException extends RuntimeException {

    private final String messageCode;

    private final long retryAfterSeconds;

    /**
     * @param messageCode message code taking the remaining seconds as its argument
     * @param message English rendering of the message, used in logs
     */
    public RateLimitExceededException(String messageCode, String message, long retryAfterSeconds) {
        super(message);
        this.messageCode = messageCode;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getMessageCode() {
        return messageCode;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
