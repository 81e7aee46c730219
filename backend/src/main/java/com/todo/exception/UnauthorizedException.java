package com.todo.exception;

/**
 * Exception thrown when an authenticated user attempts to touch a resource owned
 * by someone else.
 *
 * This is distinct from authentication failures. Authentication failures (401)
 * occur when the caller cannot prove who they are (missing, expired or revoked
 * token); authorization failures (403) occur when the caller is known but the
 * task, project, tag, saved view or notification belongs to another user.
 *
 * GlobalExceptionHandler maps this to HTTP 403 Forbidden.
 *
 * @see com.todo.exception.GlobalExceptionHandler
 */
public class UnauthorizedException extends RuntimeException {

    public static final String MESSAGE_CODE = "error.access_denied";

    private final Object[] args;

    public UnauthorizedException(String message) {
        super(message);
        this.args = null;
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
        this.args = null;
    }

    private UnauthorizedException(String message, Object[] args) {
        super(message);
        this.args = args;
    }

    /**
     * Constructs a new UnauthorizedException for accessing another user's resource.
     *
     * @param resourceType the type of resource (e.g., "task", "project")
     * @param resourceId the ID of the resource
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException accessDenied(String resourceType, Object resourceId) {
        return new UnauthorizedException(
                String.format("Access denied to %s '%s'. You do not have permission to access this resource.",
                        resourceType, resourceId),
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
