/*
 * Where: Deadline service layer
 * What: Application metrics for issued notifications, delivery, escalation and sweeps
 * Why: Escalation volume and channel failures are watched from Prometheus
 */
package com.example.deadline.service;

import com.example.deadline.model.EscalationLevel;
import com.example.deadline.model.NotificationType;
import com.example.deadline.service.channel.ChannelStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class DeadlineMetrics {

  static final String METRIC_NOTIFICATIONS_CREATED = "deadline.notifications.created";
  static final String METRIC_DELIVERY_TOTAL = "deadline.delivery.total";
  static final String METRIC_ESCALATION_ISSUED = "deadline.escalation.issued";
  static final String METRIC_SWEEP_FAILURES = "deadline.sweep.failures";
  static final String METRIC_PENDING_CURRENT = "deadline.pending.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger pendingCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public DeadlineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_PENDING_CURRENT, pendingCurrent, AtomicInteger::get)
        .description("Notifications waiting for dispatch at the last flush")
        .register(meterRegistry);
  }

  public void recordCreated(NotificationType type) {
    counter(METRIC_NOTIFICATIONS_CREATED, "Notifications created", Tags.of("type", type.name()))
        .increment();
  }

  public void recordDelivery(String channel, ChannelStatus status) {
    counter(
            METRIC_DELIVERY_TOTAL,
            "Channel delivery attempts by outcome",
            Tags.of("channel", channel, "result", status.name().toLowerCase(Locale.ROOT)))
        .increment();
  }

  public void recordEscalation(EscalationLevel level) {
    counter(
            METRIC_ESCALATION_ISSUED,
            "Escalation notifications issued",
            Tags.of("level", String.valueOf(level.level())))
        .increment();
  }

  public void recordSweepFailure(String unit) {
    counter(METRIC_SWEEP_FAILURES, "Units that failed inside a sweep", Tags.of("unit", unit))
        .increment();
  }

  public void updatePendingCurrent(int pending) {
    pendingCurrent.set(Math.max(pending, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final StringBuilder key = new StringBuilder(name);
    tags.forEach(tag -> key.append('|').append(tag.getKey()).append('=').append(tag.getValue()));
    return counters.computeIfAbsent(
        key.toString(),
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
