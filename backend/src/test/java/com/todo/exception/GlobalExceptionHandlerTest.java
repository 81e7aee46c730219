package com.todo.exception;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.TypeMismatchException;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.context.support.MessageSourceAccessor;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler.
 *
 * Checks the RFC 7807 body, the status mapping, the snake_case
 * {@code errors} map the front end renders next to form inputs, and that
 * messages follow the request locale.
 */
@DisplayName("GlobalExceptionHandler Unit Tests")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;
    private ServletWebRequest request;

    @BeforeEach
    void setUp() {
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding("UTF-8");
        messageSource.setFallbackToSystemLocale(false);

        handler = new GlobalExceptionHandler(new MessageSourceAccessor(messageSource));
        request = new ServletWebRequest(new MockHttpServletRequest("POST", "/api/tasks"));
        LocaleContextHolder.setLocale(Locale.ENGLISH);
    }

    @AfterEach
    void tearDown() {
        LocaleContextHolder.resetLocaleContext();
    }

    @Test
    @DisplayName("ValidationException should map to 422 with the resolved field messages")
    void testValidationException() {
        ResponseEntity<ProblemDetail> response = handler.handleValidationException(
                ValidationException.of("tag_ids", "validation.tag_ids.invalid"), request);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        ProblemDetail body = response.getBody();
        assertNotNull(body);
        assertEquals("https://api.todo.app/errors/validation-failed", body.getType().toString());
        assertEquals("/api/tasks", body.getInstance().toString());
        assertEquals("The selected tag ids are invalid.", body.getDetail());
        assertEquals(Map.of("tag_ids", List.of("The selected tag ids are invalid.")), body.getProperties().get("errors"));
        assertNotNull(body.getProperties().get("timestamp"));
    }

    @Test
    @DisplayName("a Persian request should get the Persian message")
    void testValidationException_Persian() {
        // Arrange
        LocaleContextHolder.setLocale(Locale.forLanguageTag("fa"));

        // Act
        ResponseEntity<ProblemDetail> response = handler.handleValidationException(
                ValidationException.of("title", "validation.title.required"), request);

        // Assert
        assertEquals("فیلد عنوان الزامی است.", response.getBody().getDetail());
        assertEquals(Map.of("title", List.of("فیلد عنوان الزامی است.")), response.getBody().getProperties().get("errors"));
        assertEquals("Validation Failed", response.getBody().getTitle());
    }

    @Test
    @DisplayName("a message without a catalog entry should be shown as given")
    void testValidationException_FreeText() {
        ResponseEntity<ProblemDetail> response = handler.handleValidationException(
                ValidationException.of("name", "Something specific went wrong."), request);

        assertEquals("Something specific went wrong.", response.getBody().getDetail());
    }

    @Test
    @DisplayName("bean validation errors should be keyed by snake_case field name")
    void testBindException_RequestBody() throws Exception {
        // Arrange
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "createTaskRequest");
        bindingResult.addError(new FieldError(
                "createTaskRequest", "dueDate", "The due date is not a valid date."));
        MethodParameter parameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("sampleHandler", String.class), 0);

        // Act
        ResponseEntity<ProblemDetail> response = handler.handleBindException(
                new MethodArgumentNotValidException(parameter, bindingResult), request);

        // Assert
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals(List.of("The due date is not a valid date."), errorsOf(response).get("due_date"));
    }

    @Test
    @DisplayName("a query value of the wrong type should report the expected type on its snake_case key")
    void testBindException_TypeMismatch() {
        // Arrange
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(null, "taskListQuery");
        FieldError perPage = new FieldError("taskListQuery", "per_page", "abc", true,
                new String[]{"typeMismatch"}, null, "Failed to convert value");
        perPage.wrap(new TypeMismatchException("abc", Integer.class));
        bindingResult.addError(perPage);
        bindingResult.addError(new FieldError("taskListQuery", "sortOrder", "The sort order must be asc or desc."));

        // Act
        ResponseEntity<ProblemDetail> response = handler.handleBindException(new BindException(bindingResult), request);

        // Assert
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        Map<String, List<String>> errors = errorsOf(response);
        assertEquals(List.of("The per page must be an integer."), errors.get("per_page"));
        assertEquals(List.of("The sort order must be asc or desc."), errors.get("sort_order"));
        assertEquals("The per page must be an integer.", response.getBody().getDetail());
    }

    @Test
    @DisplayName("a malformed query parameter should be a 422 field error, a malformed path id a 400")
    void testTypeMismatch() throws Exception {
        // Arrange
        MethodParameter queryParameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("sampleQuery", Integer.class), 0);
        MethodParameter pathParameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("samplePath", UUID.class), 0);

        // Act
        ResponseEntity<ProblemDetail> queryResponse = handler.handleTypeMismatchException(
                new MethodArgumentTypeMismatchException("abc", Integer.class, "limit", queryParameter, null), request);
        ResponseEntity<ProblemDetail> pathResponse = handler.handleTypeMismatchException(
                new MethodArgumentTypeMismatchException("nope", UUID.class, "id", pathParameter, null), request);

        // Assert
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, queryResponse.getStatusCode());
        assertEquals(Map.of("limit", List.of("The limit must be an integer.")), errorsOf(queryResponse));
        assertEquals(HttpStatus.BAD_REQUEST, pathResponse.getStatusCode());
        assertEquals("Invalid value for parameter 'id'.", pathResponse.getBody().getDetail());
    }

    @Test
    @DisplayName("ownership and lookup failures should map to 403 and 404")
    void testAccessAndNotFound() {
        UUID id = UUID.randomUUID();

        ResponseEntity<ProblemDetail> forbidden =
                handler.handleUnauthorizedException(UnauthorizedException.accessDenied("task", id), request);
        ResponseEntity<ProblemDetail> notFound =
                handler.handleResourceNotFoundException(ResourceNotFoundException.of("Task", id), request);

        assertEquals(HttpStatus.FORBIDDEN, forbidden.getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, notFound.getStatusCode());
        assertEquals("Task '" + id + "' not found.", notFound.getBody().getDetail());
    }

    @Test
    @DisplayName("an unknown endpoint should map to 404")
    void testNoResourceFound() {
        ResponseEntity<ProblemDetail> response = handler.handleNoResourceFoundException(
                new NoResourceFoundException(HttpMethod.GET, "api/unknown"), request);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("https://api.todo.app/errors/endpoint-not-found", response.getBody().getType().toString());
        assertEquals("The requested endpoint 'GET /api/unknown' does not exist.", response.getBody().getDetail());
    }

    @Test
    @DisplayName("a wrong HTTP method should map to 405 with an Allow header")
    void testMethodNotSupported() {
        ResponseEntity<ProblemDetail> response = handler.handleMethodNotSupportedException(
                new HttpRequestMethodNotSupportedException("PATCH", List.of("GET", "POST")), request);

        assertEquals(HttpStatus.METHOD_NOT_ALLOWED, response.getStatusCode());
        assertEquals(405, response.getBody().getStatus());
        assertEquals("The PATCH method is not supported for this endpoint.", response.getBody().getDetail());
        assertTrue(response.getHeaders().getAllow().contains(HttpMethod.GET));
    }

    @Test
    @DisplayName("a non-JSON body should map to 415")
    void testMediaTypeNotSupported() {
        ResponseEntity<ProblemDetail> response = handler.handleMediaTypeNotSupportedException(
                new HttpMediaTypeNotSupportedException(MediaType.TEXT_PLAIN, List.of(MediaType.APPLICATION_JSON),
                        HttpMethod.POST), request);

        assertEquals(HttpStatus.UNSUPPORTED_MEDIA_TYPE, response.getStatusCode());
        assertEquals("https://api.todo.app/errors/unsupported-media-type", response.getBody().getType().toString());
        assertEquals(List.of(MediaType.APPLICATION_JSON), response.getHeaders().getAccept());
    }

    @Test
    @DisplayName("rate limiting should map to 429 with a Retry-After header")
    void testRateLimitExceeded() {
        ResponseEntity<ProblemDetail> response = handler.handleRateLimitExceededException(
                new RateLimitExceededException("auth.too_many_logins", "Too many login attempts.", 42), request);

        assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
        assertEquals("42", response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        assertEquals(42L, response.getBody().getProperties().get("retry_after"));
        assertEquals("Too many login attempts. Please try again in 42 seconds.", response.getBody().getDetail());
    }

    @Test
    @DisplayName("bad credentials should map to 401 with the message on the email field")
    void testBadCredentials() {
        ResponseEntity<ProblemDetail> response = handler.handleBadCredentialsException(
                new BadCredentialsException("These credentials do not match our records."), request);

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        assertEquals(Map.of("email", List.of("The provided credentials are incorrect.")),
                response.getBody().getProperties().get("errors"));
    }

    @Test
    @DisplayName("unexpected errors should not echo the exception text")
    void testUnhandledException() {
        ResponseEntity<ProblemDetail> response = handler.handleUnhandledException(
                new IllegalStateException("connection string with password"), request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertFalse(response.getBody().getDetail().contains("password"));
        assertTrue(response.getBody().getProperties().get("error_id").toString().startsWith("ERR-"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, List<String>> errorsOf(ResponseEntity<ProblemDetail> response) {
        return (Map<String, List<String>>) response.getBody().getProperties().get("errors");
    }

    @SuppressWarnings("unused")
    private void sampleHandler(String body) {
    }

    @SuppressWarnings("unused")
    private void sampleQuery(@RequestParam("limit") Integer limit) {
    }

    @SuppressWarnings("unused")
    private void samplePath(@PathVariable("id") UUID id) {
    }
}
