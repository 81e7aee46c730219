package com.todo.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.Map;

/**
 * Paging information of a list response. Pages are 1-based; {@code from} and
 * {@code to} are the 1-based positions of the first and last item on the page
 * and are null for an empty page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageMeta {

    private int currentPage;

    private int lastPage;

    private int perPage;

    private long total;

    private Long from;

    private Long to;

    /**
     * Search text, only set by search listings.
     */
    private String query;

    private Map<String, Object> filtersApplied;

    public static PageMeta of(Page<?> page) {
        long offset = (long) page.getNumber() * page.getSize();
        boolean empty = page.getNumberOfElements() == 0;
        return PageMeta.builder()
                .currentPage(page.getNumber() + 1)
                .lastPage(Math.max(page.getTotalPages(), 1))
                .perPage(page.getSize())
                .total(page.getTotalElements())
                .from(empty ? null : offset + 1)
                .to(empty ? null : offset + page.getNumberOfElements())
                .build();
    }
}
