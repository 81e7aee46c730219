package com.todo.dto.request;

import com.todo.entity.Task;
import com.todo.exception.ValidationException;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.BindParam;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the calendar endpoint: an inclusive day range, optional
 * priorities and whether completed tasks are shown.
 *
 * {@code priority} may repeat or hold a comma separated list.
 */
@Getter
@ToString
public class CalendarParams {

    @NotNull(message = "{validation.start_date.required}")
    private final LocalDate startDate;

    @NotNull(message = "{validation.end_date.required}")
    private final LocalDate endDate;

    private final List<@Pattern(regexp = "(?i)low|medium|high", message = "{validation.priority.invalid}") String> priority;

    private final Boolean includeCompleted;

    @Builder
    public CalendarParams(@BindParam("start_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                          @BindParam("end_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
                          List<String> priority,
                          @BindParam("include_completed") Boolean includeCompleted) {
        this.startDate = startDate;
        this.endDate = endDate;
        this.priority = priority == null ? new ArrayList<>() : priority;
        this.includeCompleted = includeCompleted;
    }

    /**
     * @throws ValidationException if the range ends before it starts
     */
    public void requireOrderedRange() {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw ValidationException.of("end_date", "validation.end_date.after_or_equal");
        }
    }

    public List<Task.Priority> getPriorities() {
        return priority.stream()
                .filter(value -> !value.isBlank())
                .map(Task.Priority::fromValue)
                .toList();
    }

    public boolean isIncludeCompleted() {
        return Boolean.TRUE.equals(includeCompleted);
    }
}
