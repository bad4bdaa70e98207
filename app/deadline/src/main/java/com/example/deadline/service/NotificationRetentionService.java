/*
 * Where: Deadline service layer
 * What: Deletes read notifications past the retention period
 * Why: Keeps the table bounded without removing history that dedup still consults
 */
package com.example.deadline.service;

import com.example.deadline.config.DeadlineMonitorProperties;
import com.example.deadline.config.RetentionProperties;
import com.example.deadline.repository.NotificationRepository;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final RetentionProperties properties;
  private final DeadlineMonitorProperties monitorProperties;
  private final Clock clock;

  @PostConstruct
  void warnIfRetentionShorterThanDedupWindow() {
    final Duration configured = Duration.ofDays(properties.retentionDays());
    final Duration dedupWindow = monitorProperties.longestDedupWindow();
    if (configured.compareTo(dedupWindow) < 0) {
      logger.warn(
          "deadline.retention.retention-days={} is shorter than the dedup window {}; using the dedup window",
          properties.retentionDays(),
          dedupWindow);
    }
  }

  /** @return number of deleted notifications */
  public int cleanup() {
    if (!properties.enabled()) {
      logger.debug("notification retention disabled");
      return 0;
    }
    final Instant threshold = Instant.now(clock).minus(effectiveRetention());
    final int deleted = notificationRepository.deleteReadOlderThan(threshold);
    logger.info("notification retention cleanup deleted={} threshold={}", deleted, threshold);
    return deleted;
  }

  /** Never shorter than the longest dedup window. */
  @VisibleForTesting
  Duration effectiveRetention() {
    final Duration configured = Duration.ofDays(properties.retentionDays());
    final Duration dedupWindow = monitorProperties.longestDedupWindow();
    return configured.compareTo(dedupWindow) >= 0 ? configured : dedupWindow;
  }
}
