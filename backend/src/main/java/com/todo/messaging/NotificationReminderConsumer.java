package com.todo.messaging;

import com.todo.entity.NotificationLog;
import com.todo.service.NotificationDispatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Delivers queued reminders.
 *
 * Delivery failures are recorded on the notification log and do not reach the
 * broker; only unexpected errors (database down, for instance) propagate, which
 * sends the message to the dead-letter queue. Redelivery of the same rule is
 * harmless because the dispatch service skips rules sent in the past hour.
 *
 * @see com.todo.service.NotificationDispatchService#deliver(UUID)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationReminderConsumer {

    private final NotificationDispatchService dispatchService;

    @RabbitListener(queues = "${app.rabbitmq.queue.reminder:notification.reminder.queue}")
    public void onReminder(UUID ruleId) {
        log.info("Received reminder from queue: ruleId={}", ruleId);

        if (ruleId == null) {
            log.error("Received null rule id from reminder queue");
            throw new IllegalArgumentException("Rule ID cannot be null");
        }

        try {
            NotificationLog.Status outcome = dispatchService.deliver(ruleId);
            log.info("Reminder processed: ruleId={}, outcome={}", ruleId, outcome != null ? outcome.value() : "skipped");

        } catch (Exception e) {
            log.error("Unexpected error delivering reminder: ruleId={}", ruleId, e);
            throw e;
        }
    }
}
