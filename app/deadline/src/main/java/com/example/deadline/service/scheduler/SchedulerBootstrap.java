/*
 * Where: Deadline job scheduling
 * What: Registers the default jobs at startup and stops them on shutdown
 * Why: Jobs are always registered so manual triggers work even when automatic runs are disabled
 */
package com.example.deadline.service.scheduler;

import com.example.deadline.config.SchedulerProperties;
import com.example.deadline.service.DeadlineMonitorService;
import com.example.deadline.service.NotificationRetentionService;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SchedulerBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerBootstrap.class);

  public static final String DEADLINE_CHECKS = "deadline-checks";
  public static final String NOTIFICATION_PROCESSING = "notification-processing";
  public static final String DAILY_CLEANUP = "daily-cleanup";
  public static final String WEEKLY_REMINDERS = "weekly-reminders";

  private final JobScheduler jobScheduler;
  private final SchedulerProperties properties;
  private final DeadlineMonitorService monitorService;
  private final NotificationRetentionService retentionService;

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    registerDefaults();
    if (properties.enabled()) {
      initialize();
    } else {
      logger.info("automatic deadline jobs disabled; jobs registered for manual triggers only");
    }
  }

  /** Registers missing default jobs and arms every stopped one. */
  public int initialize() {
    registerDefaults();
    final int started = jobScheduler.startAll();
    logger.info("deadline scheduler initialized started={}", started);
    return started;
  }

  @PreDestroy
  public void shutdown() {
    jobScheduler.stopAllJobs();
    logger.info("deadline scheduler stopped");
  }

  private void registerDefaults() {
    registerIfAbsent(
        DEADLINE_CHECKS,
        properties.deadlineCheckInterval(),
        () -> monitorService.runAllChecks().describe());
    registerIfAbsent(
        NOTIFICATION_PROCESSING,
        properties.notificationProcessingInterval(),
        () -> monitorService.processPendingNotifications().describe());
    registerIfAbsent(
        DAILY_CLEANUP,
        properties.dailyCleanupInterval(),
        () -> "deleted=" + retentionService.cleanup());
    registerIfAbsent(
        WEEKLY_REMINDERS,
        properties.weeklyReminderInterval(),
        () -> monitorService.runReminderChecks().describe());
  }

  private void registerIfAbsent(String name, Duration interval, JobTask task) {
    if (!jobScheduler.isRegistered(name)) {
      jobScheduler.registerJob(name, interval, task);
    }
  }
}
