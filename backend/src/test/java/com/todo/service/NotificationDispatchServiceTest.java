package com.todo.service;

import com.todo.entity.NotificationLog;
import com.todo.entity.NotificationRule;
import com.todo.entity.Task;
import com.todo.entity.User;
import com.todo.entity.UserNotificationSetting;
import com.todo.messaging.NotificationReminderProducer;
import com.todo.repository.NotificationLogRepository;
import com.todo.repository.NotificationRuleRepository;
import com.todo.repository.UserNotificationSettingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;
import org.springframework.mail.MailSendException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for NotificationDispatchService.
 *
 * Tests the reminder pipeline including:
 * - Selection of due rules (window, channel switches, recent sends)
 * - Queue failures not aborting the scan
 * - Delivery by channel and the resulting log status
 * - last_sent_at only set after a successful delivery
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationDispatchService Unit Tests")
class NotificationDispatchServiceTest {

    @Mock
    private NotificationRuleRepository ruleRepository;

    @Mock
    private NotificationLogRepository logRepository;

    @Mock
    private UserNotificationSettingRepository settingRepository;

    @Mock
    private NotificationReminderProducer producer;

    @Mock
    private MailService mailService;

    @InjectMocks
    private NotificationDispatchService dispatchService;

    private static final LocalDateTime NOW = LocalDateTime.of(2030, 1, 15, 12, 0);

    private User user;
    private Task task;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(dispatchService, "dueWindowMinutes", 5L);

        user = new User("Jane", "jane@example.com", "hash");
        user.setId(UUID.randomUUID());
        task = new Task(user, "Submit tax return");
        task.setId(UUID.randomUUID());
        task.setDueDate(NOW.plusMinutes(30));
    }

    private NotificationRule rule(NotificationRule.Channel channel) {
        NotificationRule rule = new NotificationRule(user, task, channel, 30, NotificationRule.ReminderUnit.MINUTES);
        rule.setId(UUID.randomUUID());
        return rule;
    }

    @Test
    @DisplayName("findDueRuleIds should keep rules whose reminder instant is inside the window")
    void testFindDueRuleIds_Window() {
        // Arrange
        NotificationRule due = rule(NotificationRule.Channel.EMAIL);
        NotificationRule early = rule(NotificationRule.Channel.EMAIL);
        early.setReminderOffset(10);
        NotificationRule alreadySent = rule(NotificationRule.Channel.EMAIL);
        alreadySent.setLastSentAt(NOW.minusDays(1));

        when(ruleRepository.findScanCandidates(NOW.minusMinutes(5)))
                .thenReturn(List.of(due, early, alreadySent));
        when(settingRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(logRepository.countSentSince(eq(due.getId()), any(LocalDateTime.class))).thenReturn(0L);

        // Act
        List<UUID> ids = dispatchService.findDueRuleIds(NOW);

        // Assert
        assertEquals(List.of(due.getId()), ids);
    }

    @Test
    @DisplayName("findDueRuleIds should respect the owner's channel switches")
    void testFindDueRuleIds_ChannelSwitches() {
        NotificationRule email = rule(NotificationRule.Channel.EMAIL);
        NotificationRule inApp = rule(NotificationRule.Channel.IN_APP);
        UserNotificationSetting settings = new UserNotificationSetting(user);
        settings.setEmailNotificationsEnabled(false);

        when(ruleRepository.findScanCandidates(any())).thenReturn(List.of(email, inApp));
        when(settingRepository.findByUserId(user.getId())).thenReturn(Optional.of(settings));
        when(logRepository.countSentSince(eq(inApp.getId()), any(LocalDateTime.class))).thenReturn(0L);

        assertEquals(List.of(inApp.getId()), dispatchService.findDueRuleIds(NOW));
        verify(settingRepository, times(1)).findByUserId(user.getId());
    }

    @Test
    @DisplayName("findDueRuleIds should skip a rule sent within the last hour")
    void testFindDueRuleIds_RecentlySent() {
        NotificationRule rule = rule(NotificationRule.Channel.EMAIL);
        when(ruleRepository.findScanCandidates(any())).thenReturn(List.of(rule));
        when(settingRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(logRepository.countSentSince(rule.getId(), NOW.minusHours(1))).thenReturn(1L);

        assertTrue(dispatchService.findDueRuleIds(NOW).isEmpty());
    }

    @Test
    @DisplayName("findDueRuleIds should select a rule whose offset is longer than a year")
    void testFindDueRuleIds_LongOffset() {
        // Arrange
        task.setDueDate(NOW.plusDays(500));
        NotificationRule longOffset = new NotificationRule(user, task, NotificationRule.Channel.IN_APP,
                500, NotificationRule.ReminderUnit.DAYS);
        longOffset.setId(UUID.randomUUID());

        when(ruleRepository.findScanCandidates(NOW.minusMinutes(5))).thenReturn(List.of(longOffset));
        when(settingRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(logRepository.countSentSince(eq(longOffset.getId()), any(LocalDateTime.class))).thenReturn(0L);

        // Act
        List<UUID> ids = dispatchService.findDueRuleIds(NOW);

        // Assert
        assertEquals(List.of(longOffset.getId()), ids);
    }

    @Test
    @DisplayName("scanAndPublish should continue past a queue failure")
    void testScanAndPublish_QueueFailure() {
        // Due relative to the real clock
        task.setDueDate(LocalDateTime.now().plusMinutes(30).plusSeconds(-30));
        NotificationRule first = rule(NotificationRule.Channel.EMAIL);
        NotificationRule second = rule(NotificationRule.Channel.EMAIL);

        when(ruleRepository.findScanCandidates(any())).thenReturn(List.of(first, second));
        when(settingRepository.findByUserId(user.getId())).thenReturn(Optional.empty());
        when(logRepository.countSentSince(any(), any())).thenReturn(0L);
        doThrow(new AmqpException("broker down")).when(producer).sendReminder(first.getId());

        int queued = dispatchService.scanAndPublish();

        assertEquals(1, queued);
        verify(producer).sendReminder(second.getId());
    }

    @Test
    @DisplayName("deliver should mail an email reminder and stamp the rule")
    void testDeliver_Email() {
        // Arrange
        NotificationRule rule = rule(NotificationRule.Channel.EMAIL);
        when(ruleRepository.findById(rule.getId())).thenReturn(Optional.of(rule));
        when(logRepository.countSentSince(eq(rule.getId()), any(LocalDateTime.class))).thenReturn(0L);
        when(logRepository.save(any(NotificationLog.class))).thenAnswer(returnsFirstArg());

        // Act
        NotificationLog.Status status = dispatchService.deliver(rule.getId());

        // Assert
        assertEquals(NotificationLog.Status.SENT, status);
        verify(mailService).sendTaskReminder(user, task, rule);
        assertNotNull(rule.getLastSentAt());
        verify(ruleRepository).save(rule);

        ArgumentCaptor<NotificationLog> entry = ArgumentCaptor.forClass(NotificationLog.class);
        verify(logRepository, atLeastOnce()).save(entry.capture());
        NotificationLog written = entry.getValue();
        assertEquals(30, written.getMetadata().get("reminder_offset"));
        assertEquals("minutes", written.getMetadata().get("reminder_unit"));
        assertEquals("Submit tax return", written.getMetadata().get("task_title"));
    }

    @Test
    @DisplayName("deliver should record a mail failure and leave the rule retryable")
    void testDeliver_MailFailure() {
        NotificationRule rule = rule(NotificationRule.Channel.EMAIL);
        when(ruleRepository.findById(rule.getId())).thenReturn(Optional.of(rule));
        when(logRepository.countSentSince(eq(rule.getId()), any(LocalDateTime.class))).thenReturn(0L);
        when(logRepository.save(any(NotificationLog.class))).thenAnswer(returnsFirstArg());
        doThrow(new MailSendException("SMTP unavailable")).when(mailService).sendTaskReminder(user, task, rule);

        NotificationLog.Status status = dispatchService.deliver(rule.getId());

        assertEquals(NotificationLog.Status.FAILED, status);
        assertNull(rule.getLastSentAt());
        verify(ruleRepository, never()).save(any());
    }

    @Test
    @DisplayName("deliver should fail unsupported channels without touching the rule")
    void testDeliver_UnsupportedChannel() {
        NotificationRule rule = rule(NotificationRule.Channel.SMS);
        when(ruleRepository.findById(rule.getId())).thenReturn(Optional.of(rule));
        when(logRepository.countSentSince(eq(rule.getId()), any(LocalDateTime.class))).thenReturn(0L);
        when(logRepository.save(any(NotificationLog.class))).thenAnswer(returnsFirstArg());

        assertEquals(NotificationLog.Status.FAILED, dispatchService.deliver(rule.getId()));

        ArgumentCaptor<NotificationLog> entry = ArgumentCaptor.forClass(NotificationLog.class);
        verify(logRepository, atLeastOnce()).save(entry.capture());
        assertEquals("Unknown channel: sms", entry.getValue().getErrorMessage());
        assertNull(rule.getLastSentAt());
        verifyNoInteractions(mailService);
    }

    @Test
    @DisplayName("deliver should skip disabled and missing rules")
    void testDeliver_Skipped() {
        NotificationRule disabled = rule(NotificationRule.Channel.IN_APP);
        disabled.setIsEnabled(false);
        UUID missing = UUID.randomUUID();
        when(ruleRepository.findById(disabled.getId())).thenReturn(Optional.of(disabled));
        when(ruleRepository.findById(missing)).thenReturn(Optional.empty());

        assertNull(dispatchService.deliver(disabled.getId()));
        assertNull(dispatchService.deliver(missing));
        verify(logRepository, never()).save(any());
    }
}
