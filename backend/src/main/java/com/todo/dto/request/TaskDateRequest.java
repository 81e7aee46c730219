package com.todo.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Moves a task to another due date, as done by calendar drag and drop.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskDateRequest {

    @NotNull(message = "{validation.due_date.required}")
    private LocalDateTime dueDate;
}
