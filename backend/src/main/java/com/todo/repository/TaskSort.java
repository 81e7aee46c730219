package com.todo.repository;

import java.util.Arrays;
import java.util.Locale;

/**
 * Sort keys accepted by task listings. RELEVANCE is only meaningful with a search text.
 */
public enum TaskSort {
    RELEVANCE("relevance"),
    PRIORITY("priority"),
    DUE_DATE("due_date"),
    CREATED_AT("created_at"),
    TITLE("title");

    private final String key;

    TaskSort(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * @param key the request value, e.g. "due_date"
     * @return the sort, or null when the key is not recognised
     */
    public static TaskSort fromKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(sort -> sort.key.equals(normalized))
                .findFirst()
                .orElse(null);
    }
}
