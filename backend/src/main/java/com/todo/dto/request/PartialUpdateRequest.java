package com.todo.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.HashSet;
import java.util.Set;

/**
 * Base for PATCH-style bodies where an explicit {@code null} means "clear the
 * value" and an absent key means "leave it alone". Subclasses record the keys
 * they care about from their setters, which Jackson only calls for keys present
 * in the JSON.
 */
public abstract class PartialUpdateRequest {

    @JsonIgnore
    private final Set<String> presentFields = new HashSet<>();

    protected void markPresent(String field) {
        presentFields.add(field);
    }

    /**
     * @param field the Java property name
     * @return true if the key was present in the request body, even with a null value
     */
    public boolean isPresent(String field) {
        return presentFields.contains(field);
    }
}
