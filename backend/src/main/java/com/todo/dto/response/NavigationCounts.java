package com.todo.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NavigationCounts {

    private long inbox;

    private long allTasks;

    private long completed;

    private long today;

    private long overdue;

    private long upcoming;

    private long projects;

    private long tags;

    private long savedViews;
}
