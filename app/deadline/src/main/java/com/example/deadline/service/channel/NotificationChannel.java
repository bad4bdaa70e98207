/*
 * Where: Deadline delivery channels
 * What: Contract of an outbound channel (email, push)
 * Why: The dispatcher iterates channels without knowing their providers
 */
package com.example.deadline.service.channel;

import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.UserRecord;
import java.util.Map;

public interface NotificationChannel {

  /** Short name used in logs and metric tags. */
  String name();

  /** Whether the recipient's preferences ask for this channel. */
  boolean isEnabledFor(UserRecord recipient);

  /**
   * Renders and sends the notification.
   *
   * @return SENT with a provider reference, or SKIPPED when the channel is not configured
   * @throws ChannelDeliveryException when the provider refuses the message
   */
  ChannelDeliveryResult deliver(
      UserRecord recipient, NotificationRecord notification, Map<String, Object> metadata);
}
