package com.todo.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for reminder delivery.
 *
 * Architecture:
 * - Exchange: {@code todo.exchange} (direct)
 * - Main Queue: {@code notification.reminder.queue}, holding ids of rules that the
 *   scan found due
 * - DLQ: {@code notification.reminder.dlq}, for messages the consumer rejected
 *   or that expired before delivery
 *
 * The queue TTL is kept near the due window: a reminder that waits longer is
 * useless, and the next scan republishes rules that are still due.
 *
 * @see com.todo.messaging.NotificationReminderProducer
 * @see com.todo.messaging.NotificationReminderConsumer
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    @Value("${app.rabbitmq.exchange.todo:todo.exchange}")
    private String todoExchange;

    @Value("${app.rabbitmq.queue.reminder:notification.reminder.queue}")
    private String reminderQueue;

    @Value("${app.rabbitmq.queue.reminder-dlq:notification.reminder.dlq}")
    private String reminderDLQ;

    @Value("${app.rabbitmq.routing-key.reminder:notification.reminder}")
    private String reminderRoutingKey;

    @Value("${app.rabbitmq.routing-key.dlq:notification.reminder.dlq}")
    private String dlqRoutingKey;

    @Value("${app.rabbitmq.queue.ttl:300000}")
    private long queueTTL;

    @Value("${app.rabbitmq.queue.max-length:10000}")
    private int queueMaxLength;

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter());

        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (ack) {
                log.debug("Message published successfully to RabbitMQ");
            } else {
                log.error("Failed to publish message to RabbitMQ: {}", cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned -> log.error(
                "Message returned from RabbitMQ - Exchange: {}, RoutingKey: {}, ReplyText: {}",
                returned.getExchange(),
                returned.getRoutingKey(),
                returned.getReplyText()));

        log.info("RabbitTemplate configured with JSON message converter and publisher confirms");
        return rabbitTemplate;
    }

    @Bean
    public Queue reminderDLQ() {
        log.info("Configuring DLQ: {} (durable=true)", reminderDLQ);
        return QueueBuilder.durable(reminderDLQ).build();
    }

    /**
     * Reminder queue: durable, bounded, with expired and rejected messages
     * dead-lettered to {@link #reminderDLQ()}.
     */
    @Bean
    public Queue reminderQueue() {
        log.info("Configuring queue: {} (durable=true, ttl={}, maxLength={})",
                reminderQueue, queueTTL, queueMaxLength);

        return QueueBuilder.durable(reminderQueue)
                .withArgument("x-message-ttl", queueTTL)
                .withArgument("x-max-length", queueMaxLength)
                .withArgument("x-dead-letter-exchange", todoExchange)
                .withArgument("x-dead-letter-routing-key", dlqRoutingKey)
                .build();
    }

    @Bean
    public DirectExchange todoExchange() {
        log.info("Configuring direct exchange: {} (durable=true)", todoExchange);
        return new DirectExchange(todoExchange, true, false);
    }

    @Bean
    public Binding dlqBinding() {
        return BindingBuilder
                .bind(reminderDLQ())
                .to(todoExchange())
                .with(dlqRoutingKey);
    }

    @Bean
    public Binding reminderBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}",
                reminderQueue, todoExchange, reminderRoutingKey);

        return BindingBuilder
                .bind(reminderQueue())
                .to(todoExchange())
                .with(reminderRoutingKey);
    }

    @Bean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        return new RabbitAdmin(connectionFactory);
    }
}
