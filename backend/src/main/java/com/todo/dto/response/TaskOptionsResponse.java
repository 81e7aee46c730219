package com.todo.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Choices offered by the task form and filter bar.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskOptionsResponse {

    private List<OptionItem> statuses;

    private List<OptionItem> priorities;
}
