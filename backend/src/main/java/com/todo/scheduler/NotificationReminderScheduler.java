package com.todo.scheduler;

import com.todo.service.NotificationDispatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic reminder scan. The ShedLock lock makes sure only one application
 * instance scans at a time.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationReminderScheduler {

    private final NotificationDispatchService dispatchService;

    @Scheduled(fixedRateString = "${app.notifications.scan-rate-ms:60000}")
    @SchedulerLock(name = "notificationReminderScan", lockAtMostFor = "PT5M", lockAtLeastFor = "PT30S")
    public void scanDueReminders() {
        try {
            int queued = dispatchService.scanAndPublish();
            if (queued > 0) {
                log.info("Reminder scan queued {} reminders", queued);
            } else {
                log.debug("Reminder scan found nothing due");
            }
        } catch (Exception e) {
            log.error("Reminder scan failed", e);
        }
    }
}
