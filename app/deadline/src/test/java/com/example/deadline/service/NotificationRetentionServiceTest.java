/*
 * Where: Deadline retention tests
 * What: Threshold computation of the read-notification cleanup
 * Why: Deleting history younger than a dedup window would let duplicates through
 */
package com.example.deadline.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.deadline.MutableClock;
import com.example.deadline.config.DeadlineMonitorProperties;
import com.example.deadline.config.RetentionProperties;
import com.example.deadline.repository.NotificationRepository;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationRetentionServiceTest {

  private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

  @Mock private NotificationRepository notificationRepository;

  @Test
  void deletesReadNotificationsOlderThanConfiguredDays() {
    final NotificationRetentionService service = service(true, 30, Duration.ofHours(24));
    when(notificationRepository.deleteReadOlderThan(NOW.minus(Duration.ofDays(30)))).thenReturn(4);

    assertThat(service.cleanup()).isEqualTo(4);
  }

  @Test
  void retentionIsNeverShorterThanTheLongestDedupWindow() {
    final NotificationRetentionService service = service(true, 1, Duration.ofDays(3));

    assertThat(service.effectiveRetention()).isEqualTo(Duration.ofDays(3));
    service.cleanup();
    verify(notificationRepository).deleteReadOlderThan(NOW.minus(Duration.ofDays(3)));
  }

  @Test
  void disabledRetentionDeletesNothing() {
    assertThat(service(false, 30, Duration.ofHours(24)).cleanup()).isZero();
    verify(notificationRepository, never()).deleteReadOlderThan(any());
  }

  private NotificationRetentionService service(
      boolean enabled, int retentionDays, Duration escalationCooldown) {
    return new NotificationRetentionService(
        notificationRepository,
        new RetentionProperties(enabled, retentionDays),
        new DeadlineMonitorProperties(Duration.ofHours(24), escalationCooldown, ""),
        new MutableClock(NOW));
  }
}
