package com.todo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Todo back end.
 *
 * This Spring Boot application provides the REST API for a multi-tenant personal
 * task manager, featuring:
 * - Email/password registration with session-bound JWT bearer tokens
 * - Tasks with subtasks, projects, tags and saved views
 * - Reminder notifications scanned on a schedule and delivered through RabbitMQ
 * - PostgreSQL with JSONB columns for saved-view filters and notification metadata
 * - Redis for login and password-reset rate limiting
 *
 * @version 0.0.1-SNAPSHOT
 */
@SpringBootApplication
public class TodoApplication {

    public static void main(String[] args) {
        SpringApplication.run(TodoApplication.class, args);
    }
}
