package com.todo.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception carrying field-level validation messages that can only be checked by
 * the services (uniqueness, ownership of referenced ids, cross-field rules).
 *
 * Each message is a message code from {@code messages.properties}; the handler
 * renders it in the request's locale as HTTP 422 with an {@code errors} map of
 * field name to messages, the same shape bean-validation failures produce. Text
 * that is not a known code is shown as is.
 */
public class ValidationException extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "validation.failed";

    private final Map<String, List<String>> errors;

    public ValidationException(Map<String, List<String>> errors) {
        super(firstMessage(errors));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    /**
     * @param field snake_case field name as the client sent it
     * @param message message code, e.g. {@code validation.email.unique}
     * @return an exception with a single field error
     */
    public static ValidationException of(String field, String message) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        errors.put(field, List.of(message));
        return new ValidationException(errors);
    }

    /**
     * @param fieldMessages one message code per field, in reporting order
     */
    public static ValidationException ofFields(Map<String, String> fieldMessages) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        fieldMessages.forEach((field, message) -> errors.put(field, List.of(message)));
        return new ValidationException(errors);
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }

    private static String firstMessage(Map<String, List<String>> errors) {
        return errors.values().stream()
                .filter(messages -> !messages.isEmpty())
                .map(messages -> messages.get(0))
                .findFirst()
                .orElse(DEFAULT_MESSAGE);
    }
}
