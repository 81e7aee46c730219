package com.todo.scheduler;

import com.todo.service.NotificationDispatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator view of the reminder scan: how many rules a scan would queue right
 * now. Exposed at {@code /actuator/reminders}.
 */
@Component
@Endpoint(id = "reminders")
@RequiredArgsConstructor
public class ReminderDryRunEndpoint {

    private final NotificationDispatchService dispatchService;

    @ReadOperation
    public Map<String, Object> dueReminders() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("due", dispatchService.dryRunCount());
        result.put("checked_at", LocalDateTime.now().toString());
        return result;
    }
}
