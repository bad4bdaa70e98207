/*
 * Where: Deadline notification store tests
 * What: Creation, dedup, inbox validation and metadata parsing with a mocked repository
 * Why: Dedup decisions and read ownership are enforced here before any SQL runs
 */
package com.example.deadline.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.deadline.MutableClock;
import com.example.deadline.config.DeliveryProperties;
import com.example.deadline.model.NotificationCommand;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.NotificationType;
import com.example.deadline.repository.NotificationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

  private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

  @Mock private NotificationRepository notificationRepository;
  @Mock private PlatformTransactionManager transactionManager;

  private SimpleMeterRegistry meterRegistry;
  private NotificationService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new NotificationService(
            notificationRepository,
            new DedupLockKeyGenerator(),
            new DeliveryProperties(50, Duration.ofSeconds(5), 2),
            new DeadlineMetrics(meterRegistry),
            new ObjectMapper(),
            transactionManager,
            new MutableClock(NOW));
  }

  @Test
  void createStoresMetadataAsJsonAndCountsIt() {
    final NotificationRecord record =
        service.createNotification(
            NotificationCommand.of(
                "u-1", NotificationType.SYSTEM_ALERT, "t", "m", Map.of("academicYearId", "ay-1")));

    final ArgumentCaptor<NotificationRecord> captor = ArgumentCaptor.forClass(NotificationRecord.class);
    verify(notificationRepository).insert(captor.capture());
    assertThat(captor.getValue().metadataJson()).isEqualTo("{\"academicYearId\":\"ay-1\"}");
    assertThat(captor.getValue().createdAt()).isEqualTo(NOW);
    assertThat(record.isSent()).isFalse();
    assertThat(meterRegistry.get("deadline.notifications.created").tag("type", "SYSTEM_ALERT").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void createIfAbsentSkipsWhenHistoryHasTheKey() {
    when(notificationRepository.existsSince(
            "u-1", NotificationType.UPLOAD_DEADLINE_REMINDER, "ay-1", NOW.minus(Duration.ofHours(24))))
        .thenReturn(true);

    final Optional<NotificationRecord> created =
        service.createIfAbsent(reminder(), Duration.ofHours(24));

    assertThat(created).isEmpty();
    verify(notificationRepository).lockByKey(anyLong());
    verify(notificationRepository, never()).insert(any());
  }

  @Test
  void createIfAbsentInsertsWhenHistoryIsEmpty() {
    when(notificationRepository.existsSince(any(), any(), any(), any())).thenReturn(false);

    assertThat(service.createIfAbsent(reminder(), Duration.ofHours(24))).isPresent();
    verify(notificationRepository).insert(any());
  }

  @Test
  void createIfAbsentRequiresAcademicYear() {
    final NotificationCommand command =
        NotificationCommand.of("u-1", NotificationType.UPLOAD_DEADLINE_REMINDER, "t", "m", Map.of());

    assertThatThrownBy(() -> service.createIfAbsent(command, Duration.ofHours(24)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void markReadOfUnknownOrForeignNotificationFails() {
    final UUID id = UUID.randomUUID();
    when(notificationRepository.markRead(id, "u-2")).thenReturn(0);

    assertThatThrownBy(() -> service.markRead(id, "u-2"))
        .isInstanceOf(NotificationNotFoundException.class);
  }

  @Test
  void inboxRejectsInvalidPaging() {
    assertThatThrownBy(() -> service.getUserNotifications("u-1", 0, 0, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.getUserNotifications("u-1", 10, -1, false))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unreadableMetadataIsTreatedAsEmpty() {
    final NotificationRecord broken =
        new NotificationRecord(
            UUID.randomUUID(), "u-1", NotificationType.SYSTEM_ALERT, "t", "m", null, "{oops", NOW, null, false);

    assertThat(service.readMetadata(broken)).isEmpty();
  }

  @Test
  void pendingUsesConfiguredBatchSize() {
    service.getPending();

    verify(notificationRepository).findPending(NOW, 50);
  }

  private static NotificationCommand reminder() {
    return NotificationCommand.of(
        "u-1",
        NotificationType.UPLOAD_DEADLINE_REMINDER,
        "Upload Deadline Reminder",
        "Closes soon",
        Map.of("academicYearId", "ay-1"));
  }
}
