package com.todo.service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns grouped {@code [id, count]} query rows into lookup maps.
 */
final class TaskCounts {

    private TaskCounts() {
    }

    static Map<UUID, Long> byProject(List<Object[]> rows) {
        return toMap(rows);
    }

    static Map<UUID, Long> byTag(List<Object[]> rows) {
        return toMap(rows);
    }

    private static Map<UUID, Long> toMap(List<Object[]> rows) {
        Map<UUID, Long> counts = new HashMap<>();
        for (Object[] row : rows) {
            counts.put((UUID) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
