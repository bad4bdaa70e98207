package com.example.deadline.service;

import com.example.deadline.service.channel.ChannelDeliveryResult;
import java.util.List;
import java.util.UUID;

/**
 * Result of dispatching one notification. {@code markedSent} is false when the unit was skipped
 * (notification or recipient missing) or another dispatcher had already set sent_at.
 */
public record DispatchOutcome(
    UUID notificationId, boolean markedSent, List<ChannelDeliveryResult> results, String skipReason) {

  public DispatchOutcome {
    results = List.copyOf(results);
  }

  static DispatchOutcome skipped(UUID notificationId, String reason) {
    return new DispatchOutcome(notificationId, false, List.of(), reason);
  }

  public boolean isSkipped() {
    return skipReason != null;
  }
}
