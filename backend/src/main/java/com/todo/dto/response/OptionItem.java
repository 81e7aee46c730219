package com.todo.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A selectable value with its display label.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptionItem {

    private String value;

    private String label;
}
