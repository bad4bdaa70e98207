/*
 * Where: Deadline service layer
 * What: Accepts externally created notifications and sends them now or at their scheduled time
 * Why: Future-dated notifications get their own one-shot job instead of waiting for the flush
 */
package com.example.deadline.service;

import com.example.deadline.model.NotificationCommand;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.service.scheduler.JobScheduler;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationSubmissionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationSubmissionService.class);

  static final String ONE_SHOT_PREFIX = "notification-";

  private final NotificationService notificationService;
  private final NotificationDispatcher dispatcher;
  private final JobScheduler jobScheduler;
  private final Clock clock;

  public NotificationRecord submit(NotificationCommand command) {
    final NotificationRecord record = notificationService.createNotification(command);
    final Instant scheduledFor = record.scheduledFor();
    if (scheduledFor != null && scheduledFor.isAfter(Instant.now(clock))) {
      final UUID notificationId = record.notificationId();
      jobScheduler.scheduleOnce(
          ONE_SHOT_PREFIX + notificationId,
          scheduledFor,
          () -> dispatcher.dispatch(notificationId).toString());
      logger.info("notification scheduled id={} scheduledFor={}", notificationId, scheduledFor);
    } else {
      dispatcher.dispatch(record);
    }
    return record;
  }
}
