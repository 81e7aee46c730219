package com.todo.exception;

/**
 * Exception thrown when a requested resource does not exist.
 *
 * Mapped to HTTP 404 Not Found by {@link GlobalExceptionHandler}. Note that a
 * resource which exists but belongs to another user is reported through
 * {@link UnauthorizedException} (403) instead.
 */
public class ResourceNotFoundException extends RuntimeException {

    public static final String MESSAGE_CODE = "error.not_found";

    private final Object[] args;

    public ResourceNotFoundException(String message) {
        super(message);
        this.args = null;
    }

    private ResourceNotFoundException(String message, Object[] args) {
        super(message);
        this.args = args;
    }

    /**
     * @param resourceType human readable type, e.g. "Task"
     * @param resourceId the id that was looked up
     * @return an exception with a formatted message
     */
    public static ResourceNotFoundException of(String resourceType, Object resourceId) {
        return new ResourceNotFoundException(
                String.format("%s '%s' not found.", resourceType, resourceId),
                new Object[]{resourceType, String.valueOf(resourceId)}
        );
    }

    /**
     * @return the arguments of {@link #MESSAGE_CODE}, or null when the message is free text
     */
    public Object[] getArgs() {
        return args;
    }
}
