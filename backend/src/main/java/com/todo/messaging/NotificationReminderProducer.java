package com.todo.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Publishes due reminder rules to RabbitMQ for delivery.
 *
 * Architecture Flow:
 * 1. NotificationReminderScheduler runs the scan every minute
 * 2. NotificationDispatchService selects the rules that are due
 * 3. This producer publishes each rule id to the reminder queue
 * 4. NotificationReminderConsumer delivers the reminder and records the outcome
 *
 * Message Format:
 * - Payload: UUID (notification rule id)
 * - Exchange: todo.exchange (direct)
 * - Routing Key: notification.reminder
 * - Queue: notification.reminder.queue
 *
 * Messages that expire or are rejected end up in the dead-letter queue
 * configured in {@link com.todo.config.RabbitMQConfig}.
 *
 * @see com.todo.messaging.NotificationReminderConsumer
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationReminderProducer {

    private final RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.exchange.todo:todo.exchange}")
    private String todoExchange;

    @Value("${app.rabbitmq.routing-key.reminder:notification.reminder}")
    private String reminderRoutingKey;

    /**
     * Queue a reminder rule for delivery.
     *
     * @param ruleId the rule to deliver
     * @throws IllegalArgumentException if ruleId is null
     * @throws org.springframework.amqp.AmqpException if the broker cannot be reached
     */
    public void sendReminder(UUID ruleId) {
        if (ruleId == null) {
            log.error("Attempted to send null rule id to reminder queue");
            throw new IllegalArgumentException("Rule ID cannot be null");
        }

        log.debug("Queueing reminder: ruleId={}, exchange={}, routingKey={}", ruleId, todoExchange, reminderRoutingKey);

        try {
            rabbitTemplate.convertAndSend(todoExchange, reminderRoutingKey, ruleId);
            log.info("Reminder queued: ruleId={}", ruleId);

        } catch (Exception e) {
            log.error("Failed to queue reminder: ruleId={}, error={}", ruleId, e.getMessage(), e);
            throw e;
        }
    }
}
