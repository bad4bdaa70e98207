/*
 * Where: Deadline service layer
 * What: Delivers a stored notification over the recipient's enabled channels and marks it sent
 * Why: Channel failures are isolated so one provider outage never blocks the other or the flush
 */
package com.example.deadline.service;

import com.example.deadline.config.DeliveryProperties;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.UserRecord;
import com.example.deadline.repository.UserRepository;
import com.example.deadline.service.channel.ChannelDeliveryResult;
import com.example.deadline.service.channel.ChannelExecutors;
import com.example.deadline.service.channel.NotificationChannel;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationService notificationService;
  private final UserRepository userRepository;
  private final List<NotificationChannel> channels;
  private final ChannelExecutors channelExecutors;
  private final DeliveryProperties properties;
  private final DeadlineMetrics metrics;

  public NotificationDispatcher(
      NotificationService notificationService,
      UserRepository userRepository,
      List<NotificationChannel> channels,
      ChannelExecutors channelExecutors,
      DeliveryProperties properties,
      DeadlineMetrics metrics) {
    this.notificationService = notificationService;
    this.userRepository = userRepository;
    this.channels = List.copyOf(channels);
    this.channelExecutors = channelExecutors;
    this.properties = properties;
    this.metrics = metrics;
  }

  public DispatchOutcome dispatch(UUID notificationId) {
    final Optional<NotificationRecord> found = notificationService.findById(notificationId);
    if (found.isEmpty()) {
      logger.error("notification not found for dispatch id={}", notificationId);
      return DispatchOutcome.skipped(notificationId, "notification not found");
    }
    return dispatch(found.get());
  }

  public DispatchOutcome dispatch(NotificationRecord notification) {
    final UUID notificationId = notification.notificationId();
    if (notification.isSent()) {
      return DispatchOutcome.skipped(notificationId, "already sent");
    }
    final Optional<UserRecord> recipient = userRepository.findById(notification.userId());
    if (recipient.isEmpty()) {
      logger.error(
          "recipient not found for dispatch id={} userId={}", notificationId, notification.userId());
      return DispatchOutcome.skipped(notificationId, "recipient not found");
    }
    final Map<String, Object> metadata = notificationService.readMetadata(notification);
    final List<ChannelDeliveryResult> results = deliverAll(recipient.get(), notification, metadata);
    // sent_at records that every attempt was made, not that every attempt succeeded
    final boolean marked = notificationService.markSent(notificationId);
    if (!marked) {
      logger.warn("notification already marked sent by another dispatcher id={}", notificationId);
    }
    logger.info(
        "notification dispatched id={} userId={} results={}",
        notificationId,
        notification.userId(),
        results);
    return new DispatchOutcome(notificationId, marked, results, null);
  }

  /** Dispatches one batch of due notifications in creation order. */
  public int dispatchPending() {
    final List<NotificationRecord> pending = notificationService.getPending();
    int dispatched = 0;
    for (NotificationRecord notification : pending) {
      try {
        if (dispatch(notification).markedSent()) {
          dispatched++;
        }
      } catch (DataAccessException ex) {
        metrics.recordSweepFailure("notification");
        logger.warn("notification dispatch failed id={}", notification.notificationId(), ex);
      } catch (RuntimeException ex) {
        metrics.recordSweepFailure("notification");
        logger.error("notification dispatch failed id={}", notification.notificationId(), ex);
      }
    }
    metrics.updatePendingCurrent(notificationService.countPending());
    if (!pending.isEmpty()) {
      logger.info("pending notifications processed fetched={} dispatched={}", pending.size(), dispatched);
    }
    return dispatched;
  }

  @VisibleForTesting
  List<ChannelDeliveryResult> deliverAll(
      UserRecord recipient, NotificationRecord notification, Map<String, Object> metadata) {
    final List<NotificationChannel> enabled =
        channels.stream().filter(channel -> channel.isEnabledFor(recipient)).toList();
    final List<Future<ChannelDeliveryResult>> attempts = new ArrayList<>();
    for (NotificationChannel channel : enabled) {
      attempts.add(
          channelExecutors
              .forChannel(channel.name())
              .submit(() -> channel.deliver(recipient, notification, metadata)));
    }
    // all attempts share one deadline measured from submission
    final long deadline = System.nanoTime() + properties.channelTimeout().toNanos();
    final List<ChannelDeliveryResult> results = new ArrayList<>();
    for (int i = 0; i < enabled.size(); i++) {
      final ChannelDeliveryResult result =
          await(enabled.get(i), attempts.get(i), notification, deadline);
      metrics.recordDelivery(result.channel(), result.status());
      results.add(result);
    }
    return results;
  }

  private ChannelDeliveryResult await(
      NotificationChannel channel,
      Future<ChannelDeliveryResult> attempt,
      NotificationRecord notification,
      long deadline) {
    try {
      return attempt.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      // frees the worker so later attempts on this channel are not queued behind it
      attempt.cancel(true);
      return failed(channel, notification, ex);
    } catch (ExecutionException ex) {
      return failed(channel, notification, ex.getCause() != null ? ex.getCause() : ex);
    } catch (InterruptedException ex) {
      attempt.cancel(true);
      Thread.currentThread().interrupt();
      return failed(channel, notification, ex);
    }
  }

  private ChannelDeliveryResult failed(
      NotificationChannel channel, NotificationRecord notification, Throwable cause) {
    final String reason =
        cause instanceof TimeoutException
            ? "timed out after " + properties.channelTimeout()
            : String.valueOf(cause.getMessage());
    logger.error(
        "channel delivery failed channel={} notificationId={} reason={}",
        channel.name(),
        notification.notificationId(),
        reason,
        cause);
    return ChannelDeliveryResult.failed(channel.name(), reason);
  }
}
