package com.todo.service;

import com.todo.entity.NotificationRule;
import com.todo.entity.Task;
import com.todo.entity.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Plain-text emails: task reminders, password reset links and the password
 * changed notice.
 *
 * Reminder and reset mails propagate {@link MailException} so the caller can
 * record the failure; the password changed notice is informational and only
 * logs a failed send.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MailService {

    private static final DateTimeFormatter DUE_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy 'at' h:mm a", Locale.ENGLISH);

    private final JavaMailSender mailSender;

    @Value("${app.mail.from:no-reply@todo.local}")
    private String fromAddress;

    @Value("${app.frontend-url:http://localhost:5173}")
    private String frontendUrl;

    @Value("${app.auth.password-reset.token-lifetime-minutes:60}")
    private long resetTokenLifetimeMinutes;

    /**
     * Subject line of a reminder, e.g. "Reminder: Task 'Pay rent' is due in 2 hours".
     */
    public static String reminderSubject(Task task, NotificationRule rule) {
        return String.format("Reminder: Task '%s' is due %s", task.getTitle(), rule.getReminderText());
    }

    public void sendTaskReminder(User user, Task task, NotificationRule rule) {
        StringBuilder body = new StringBuilder()
                .append("Hello ").append(user.getName()).append(",\n\n")
                .append("You have a task that's due soon!\n\n")
                .append(task.getTitle()).append("\n");
        if (task.getDescription() != null && !task.getDescription().isBlank()) {
            body.append("Description: ").append(task.getDescription()).append("\n");
        }
        body.append("Due Date: ")
                .append(task.getDueDate() != null ? task.getDueDate().format(DUE_FORMAT) : "Not set")
                .append("\n")
                .append("Reminder: This task is due ").append(rule.getReminderText()).append(".\n\n")
                .append("View task: ").append(frontendUrl).append("/tasks/").append(task.getId()).append("\n");

        send(user.getEmail(), reminderSubject(task, rule), body.toString());
        log.info("Reminder email sent for task {} to user {}", task.getId(), user.getId());
    }

    public void sendPasswordReset(User user, String plainToken) {
        String link = frontendUrl + "/reset-password?token=" + plainToken
                + "&email=" + URLEncoder.encode(user.getEmail(), StandardCharsets.UTF_8);
        String body = "Hello " + user.getName() + ",\n\n"
                + "You are receiving this email because we received a password reset request for your account.\n\n"
                + "Reset your password: " + link + "\n\n"
                + "This link will expire in " + resetTokenLifetimeMinutes + " minutes.\n\n"
                + "If you did not request a password reset, no further action is required.\n";

        send(user.getEmail(), "Reset Password Notification", body);
        log.info("Password reset email sent to user {}", user.getId());
    }

    public void sendPasswordChanged(User user) {
        String body = "Hello " + user.getName() + ",\n\n"
                + "The password for your account was just changed. "
                + "If you did not make this change, reset your password immediately.\n";
        try {
            send(user.getEmail(), "Your password has been changed", body);
        } catch (MailException e) {
            log.warn("Password changed notice could not be sent to user {}: {}", user.getId(), e.getMessage());
        }
    }

    private void send(String to, String subject, String text) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        mailSender.send(message);
    }
}
