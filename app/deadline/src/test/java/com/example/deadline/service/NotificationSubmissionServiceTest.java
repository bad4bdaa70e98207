package com.example.deadline.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.deadline.MutableClock;
import com.example.deadline.model.NotificationCommand;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.NotificationType;
import com.example.deadline.service.scheduler.JobScheduler;
import com.example.deadline.service.scheduler.JobTask;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationSubmissionServiceTest {

  private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

  @Mock private NotificationService notificationService;
  @Mock private NotificationDispatcher dispatcher;
  @Mock private JobScheduler jobScheduler;

  private NotificationSubmissionService service;

  @BeforeEach
  void setUp() {
    service =
        new NotificationSubmissionService(
            notificationService, dispatcher, jobScheduler, new MutableClock(NOW));
  }

  @Test
  void immediateNotificationIsDispatchedRightAway() {
    final NotificationRecord record = record(null);
    when(notificationService.createNotification(any())).thenReturn(record);

    assertThat(service.submit(command(null))).isSameAs(record);
    verify(dispatcher).dispatch(record);
    verify(jobScheduler, never()).scheduleOnce(any(), any(), any());
  }

  @Test
  void pastScheduleIsTreatedAsDue() {
    final NotificationRecord record = record(NOW.minusSeconds(5));
    when(notificationService.createNotification(any())).thenReturn(record);

    service.submit(command(NOW.minusSeconds(5)));

    verify(dispatcher).dispatch(record);
  }

  @Test
  void futureNotificationGetsOneShotJob() {
    final Instant at = NOW.plusSeconds(3600);
    final NotificationRecord record = record(at);
    when(notificationService.createNotification(any())).thenReturn(record);
    when(dispatcher.dispatch(record.notificationId()))
        .thenReturn(new DispatchOutcome(record.notificationId(), true, List.of(), null));

    service.submit(command(at));

    final ArgumentCaptor<JobTask> task = ArgumentCaptor.forClass(JobTask.class);
    verify(jobScheduler)
        .scheduleOnce(eq("notification-" + record.notificationId()), eq(at), task.capture());
    verify(dispatcher, never()).dispatch(any(NotificationRecord.class));

    task.getValue().run();
    verify(dispatcher).dispatch(record.notificationId());
  }

  private static NotificationCommand command(Instant scheduledFor) {
    return new NotificationCommand(
        "u-1", NotificationType.SYSTEM_ALERT, "Maintenance", "Tonight", scheduledFor, Map.of());
  }

  private static NotificationRecord record(Instant scheduledFor) {
    return new NotificationRecord(
        UUID.randomUUID(),
        "u-1",
        NotificationType.SYSTEM_ALERT,
        "Maintenance",
        "Tonight",
        scheduledFor,
        "{}",
        NOW,
        null,
        false);
  }
}
