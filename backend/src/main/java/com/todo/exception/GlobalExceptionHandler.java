package com.todo.exception;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.context.support.MessageSourceAccessor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST API endpoints.
 *
 * This class provides centralized exception handling across all controllers,
 * converting exceptions into RFC 7807 compliant error responses. Validation
 * failures additionally carry an {@code errors} property keyed by the snake_case
 * field name, each holding a list of messages, which is the shape the front end
 * renders next to form inputs.
 *
 * <p>Details and field messages are rendered in the request's locale (see
 * {@code LocaleConfig}); titles and {@code type} URIs stay English so clients
 * can match on them.
 *
 * <p>RFC 7807 Response Format:
 * <pre>
 * {
 *   "type": "https://api.todo.app/errors/validation-failed",
 *   "title": "Validation Failed",
 *   "status": 422,
 *   "detail": "The title field is required.",
 *   "instance": "/api/tasks",
 *   "timestamp": "2024-02-26T10:30:00",
 *   "errors": {
 *     "title": ["The title field is required."]
 *   }
 * }
 * </pre>
 *
 * <p>Handled Exception Categories:
 * <ul>
 *   <li>Authentication errors (401): bad credentials, deactivated account, missing token</li>
 *   <li>Authorization errors (403): resources owned by another user</li>
 *   <li>Not found errors (404): unknown ids, invalid endpoints</li>
 *   <li>Protocol errors (400, 405, 415): unreadable bodies, wrong methods, non-JSON bodies</li>
 *   <li>Validation errors (422): bean validation, query binding and service-level rules</li>
 *   <li>Rate limiting (429): login and password-reset budgets</li>
 *   <li>Server errors (500): unexpected internal errors</li>
 * </ul>
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807 Specification</a>
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final String BASE_ERROR_URI = "https://api.todo.app/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    private final MessageSourceAccessor messages;

    /**
     * Handles ResourceNotFoundException - unknown task, project, tag and so on.
     * Mapped to HTTP 404 Not Found.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            WebRequest request
    ) {
        log.debug("Resource not found: {}", ex.getMessage());

        String detail = ex.getArgs() == null
                ? ex.getMessage()
                : localize(ResourceNotFoundException.MESSAGE_CODE, ex.getArgs(), ex.getMessage());
        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                detail,
                request,
                "resource-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Handles UnauthorizedException - authenticated user lacks authorization.
     *
     * This occurs when an authenticated user attempts to access resources
     * owned by another user. Mapped to HTTP 403 Forbidden.
     */
    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorizedException(
            UnauthorizedException ex,
            WebRequest request
    ) {
        log.warn("Authorization failed: {}", ex.getMessage());

        String detail = ex.getArgs() == null
                ? ex.getMessage()
                : localize(UnauthorizedException.MESSAGE_CODE, ex.getArgs(), ex.getMessage());
        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.FORBIDDEN,
                "Access Denied",
                detail,
                request,
                "access-denied"
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problemDetail);
    }

    /**
     * Handles ValidationException - rules checked by the services.
     * Mapped to HTTP 422 Unprocessable Entity.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            ValidationException ex,
            WebRequest request
    ) {
        log.warn("Validation failed: {}", ex.getErrors());

        Map<String, List<String>> validationErrors = new LinkedHashMap<>();
        ex.getErrors().forEach((field, codes) -> validationErrors.put(field,
                codes.stream().map(code -> localize(code, null, code)).toList()));

        return validationFailed(validationErrors, request);
    }

    /**
     * Handles BindException - bean validation failures on {@code @Valid} request
     * bodies (as its MethodArgumentNotValidException subclass) and on bound query
     * objects, including query values that could not be converted to the target
     * type. Mapped to HTTP 422 Unprocessable Entity.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ProblemDetail> handleBindException(
            BindException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {} field error(s)", ex.getBindingResult().getErrorCount());

        Map<String, List<String>> validationErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            String field = SNAKE_CASE.translate(error.getField());
            validationErrors.computeIfAbsent(field, key -> new ArrayList<>()).add(fieldMessage(error, field));
        }
        ex.getBindingResult().getGlobalErrors().forEach(error -> validationErrors
                .computeIfAbsent(error.getObjectName(), key -> new ArrayList<>())
                .add(error.getDefaultMessage()));

        return validationFailed(validationErrors, request);
    }

    /**
     * Handles MissingServletRequestParameterException - a required query
     * parameter is absent. Reported as a field error (422).
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameterException(
            MissingServletRequestParameterException ex,
            WebRequest request
    ) {
        log.warn("Missing request parameter: {}", ex.getParameterName());

        String message = localize("validation.required", new Object[]{attribute(ex.getParameterName())},
                String.format("The %s field is required.", ex.getParameterName()));

        return validationFailed(Map.of(ex.getParameterName(), List.of(message)), request);
    }

    /**
     * Handles RateLimitExceededException. Mapped to HTTP 429 Too Many Requests.
     */
    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceededException(
            RateLimitExceededException ex,
            WebRequest request
    ) {
        log.warn("Rate limit exceeded: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.TOO_MANY_REQUESTS,
                "Too Many Attempts",
                localize(ex.getMessageCode(), new Object[]{String.valueOf(ex.getRetryAfterSeconds())}, ex.getMessage()),
                request,
                "rate-limited"
        );
        problemDetail.setProperty("retry_after", ex.getRetryAfterSeconds());

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(problemDetail);
    }

    /**
     * Handles BadCredentialsException - wrong email or password at login.
     * Mapped to HTTP 401 Unauthorized with the message attached to the email field.
     */
    @ExceptionHandler(BadCredentialsException.class)
    public ResponseEntity<ProblemDetail> handleBadCredentialsException(
            BadCredentialsException ex,
            WebRequest request
    ) {
        log.warn("Authentication failed: {}", ex.getMessage());

        String detail = localize("auth.failed", null, ex.getMessage());
        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNAUTHORIZED,
                "Authentication Failed",
                detail,
                request,
                "authentication-failed"
        );
        problemDetail.setProperty("errors", Map.of("email", List.of(detail)));

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problemDetail);
    }

    /**
     * Handles DisabledException - login to a deactivated account.
     * Mapped to HTTP 401 Unauthorized.
     */
    @ExceptionHandler(DisabledException.class)
    public ResponseEntity<ProblemDetail> handleDisabledException(
            DisabledException ex,
            WebRequest request
    ) {
        log.warn("Login to deactivated account rejected");

        String detail = localize("auth.disabled", null, ex.getMessage());
        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNAUTHORIZED,
                "Account Deactivated",
                detail,
                request,
                "account-deactivated"
        );
        problemDetail.setProperty("errors", Map.of("email", List.of(detail)));

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problemDetail);
    }

    /**
     * Handles AccessDeniedException - Spring Security access denial.
     *
     * This occurs when authentication is required but not provided.
     * Mapped to HTTP 401 Unauthorized.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDeniedException(
            AccessDeniedException ex,
            WebRequest request
    ) {
        log.warn("Access denied: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNAUTHORIZED,
                "Authentication Required",
                localize("error.authentication_required", null,
                        "You must be authenticated to access this resource. Please provide a valid bearer token."),
                request,
                "authentication-required"
        );

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problemDetail);
    }

    /**
     * Handles HttpMessageNotReadableException - malformed request body.
     * Mapped to HTTP 400 Bad Request.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                localize("error.malformed_body", null,
                        "The request body is malformed or contains invalid JSON. Please check your request format."),
                request,
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles MethodArgumentTypeMismatchException. A query parameter that cannot
     * be converted is a field error (422); any other argument, e.g. a path id
     * that is not a UUID, is a bad request (400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        log.warn("Invalid value for parameter '{}': {}", ex.getName(), ex.getValue());

        if (ex.getParameter().hasParameterAnnotation(RequestParam.class)) {
            String message = localize(typeMismatchCode(ex.getRequiredType()), new Object[]{attribute(ex.getName())},
                    String.format("The selected %s is invalid.", ex.getName()));
            return validationFailed(Map.of(ex.getName(), List.of(message)), request);
        }

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                localize("error.invalid_parameter", new Object[]{ex.getName()},
                        String.format("Invalid value for parameter '%s'.", ex.getName())),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles IllegalArgumentException - illegal argument passed to a method.
     * Mapped to HTTP 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles DataIntegrityViolationException - a uniqueness race lost at commit
     * time after the service-level check passed. Mapped to HTTP 409 Conflict.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrityViolationException(
            DataIntegrityViolationException ex,
            WebRequest request
    ) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.CONFLICT,
                "Conflict",
                localize("error.conflict", null,
                        "The request conflicts with existing data. Please refresh and try again."),
                request,
                "conflict"
        );

        return ResponseEntity.status(HttpStatus.CONFLICT).body(problemDetail);
    }

    /**
     * Handles NoResourceFoundException - a path that matches no endpoint.
     * Mapped to HTTP 404 Not Found.
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemDetail> handleNoResourceFoundException(
            NoResourceFoundException ex,
            WebRequest request
    ) {
        log.warn("Endpoint not found: {} {}", ex.getHttpMethod(), ex.getResourcePath());

        String endpoint = ex.getResourcePath().startsWith("/") ? ex.getResourcePath() : "/" + ex.getResourcePath();
        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Endpoint Not Found",
                localize("error.endpoint_not_found", new Object[]{ex.getHttpMethod(), endpoint},
                        String.format("The requested endpoint '%s %s' does not exist.", ex.getHttpMethod(), endpoint)),
                request,
                "endpoint-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Handles HttpRequestMethodNotSupportedException - an existing endpoint
     * called with the wrong HTTP method. Mapped to HTTP 405 Method Not Allowed
     * with an {@code Allow} header.
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ProblemDetail> handleMethodNotSupportedException(
            HttpRequestMethodNotSupportedException ex,
            WebRequest request
    ) {
        log.warn("Method not allowed: {} (supported: {})", ex.getMethod(), ex.getSupportedHttpMethods());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.METHOD_NOT_ALLOWED,
                "Method Not Allowed",
                localize("error.method_not_allowed", new Object[]{ex.getMethod()},
                        String.format("The %s method is not supported for this endpoint.", ex.getMethod())),
                request,
                "method-not-allowed"
        );

        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).headers(ex.getHeaders()).body(problemDetail);
    }

    /**
     * Handles HttpMediaTypeNotSupportedException - a request body that is not
     * JSON. Mapped to HTTP 415 Unsupported Media Type with an {@code Accept} header.
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ProblemDetail> handleMediaTypeNotSupportedException(
            HttpMediaTypeNotSupportedException ex,
            WebRequest request
    ) {
        log.warn("Unsupported content type: {}", ex.getContentType());

        String contentType = ex.getContentType() != null ? ex.getContentType().toString() : "";
        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                "Unsupported Media Type",
                localize("error.media_type_not_supported", new Object[]{contentType},
                        String.format("The content type '%s' is not supported. Send application/json.", contentType)),
                request,
                "unsupported-media-type"
        );

        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).headers(ex.getHeaders()).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions.
     *
     * Logs the full stack trace under a generated error id and returns a generic
     * message; the exception text is never echoed to the client.
     * Mapped to HTTP 500 Internal Server Error.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        String errorId = generateErrorId();
        log.error("Unexpected error occurred [{}]: {}", errorId, ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                localize("error.internal", null,
                        "An unexpected error occurred. Please try again later or contact support if the issue persists."),
                request,
                "internal-error"
        );
        problemDetail.setProperty("error_id", errorId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    /**
     * Creates a ProblemDetail object with RFC 7807 compliant fields.
     *
     * @param status the HTTP status code
     * @param title a short, human-readable title
     * @param detail a detailed explanation
     * @param request the web request context
     * @param errorType the error type identifier for the type URI
     * @return a populated ProblemDetail object
     */
    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            String errorType
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);

        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);
        problemDetail.setStatus(status.value());

        // Instance is the request path where the error occurred
        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            String path = description.substring(4);
            problemDetail.setInstance(URI.create(path));
        }

        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));

        return problemDetail;
    }

    private ResponseEntity<ProblemDetail> validationFailed(Map<String, List<String>> errors, WebRequest request) {
        String detail = errors.values().stream()
                .flatMap(List::stream)
                .findFirst()
                .orElse(localize(ValidationException.DEFAULT_MESSAGE, null, "The given data was invalid."));

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNPROCESSABLE_ENTITY,
                "Validation Failed",
                detail,
                request,
                "validation-failed"
        );
        problemDetail.setProperty("errors", errors);

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problemDetail);
    }

    /**
     * Message of a field error: the bean validation message, or for a value of
     * the wrong type a message naming the expected kind of value.
     */
    private String fieldMessage(FieldError error, String field) {
        if (!error.isBindingFailure()) {
            return error.getDefaultMessage();
        }
        Class<?> requiredType = error.contains(TypeMismatchException.class)
                ? error.unwrap(TypeMismatchException.class).getRequiredType()
                : null;
        return localize(typeMismatchCode(requiredType), new Object[]{attribute(field)},
                String.format("The selected %s is invalid.", field));
    }

    private static String typeMismatchCode(Class<?> requiredType) {
        if (requiredType == null) {
            return "validation.type.invalid";
        }
        if (Number.class.isAssignableFrom(requiredType) || requiredType == int.class || requiredType == long.class) {
            return "validation.type.integer";
        }
        if (requiredType == LocalDate.class || requiredType == LocalDateTime.class) {
            return "validation.type.date";
        }
        if (requiredType == Boolean.class || requiredType == boolean.class) {
            return "validation.type.boolean";
        }
        return "validation.type.invalid";
    }

    /**
     * Display name of a parameter in messages: {@code due_date_to} reads "due date to".
     */
    private static String attribute(String field) {
        return field.replace('_', ' ');
    }

    private String localize(String code, Object[] args, String defaultMessage) {
        return messages.getMessage(code, args, defaultMessage);
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
