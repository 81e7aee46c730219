package com.todo.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Compact search results for autocomplete.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuickSearchResponse {

    private List<QuickSearchItem> data;

    private Meta meta;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {

        private String query;

        private int limit;

        private int count;
    }
}
