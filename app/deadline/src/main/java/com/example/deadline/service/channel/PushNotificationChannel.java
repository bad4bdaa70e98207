/*
 * Where: Deadline delivery channels
 * What: Posts a flattened text message to a LINE-Notify-style push endpoint
 * Why: Push is opt-in per user and only active when a provider token is configured
 */
package com.example.deadline.service.channel;

import com.example.deadline.config.PushChannelProperties;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.UserRecord;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class PushNotificationChannel implements NotificationChannel {

  private static final Logger logger = LoggerFactory.getLogger(PushNotificationChannel.class);

  static final String NAME = "push";

  private final RestClient restClient;
  private final PushChannelProperties properties;

  public PushNotificationChannel(
      @Qualifier("pushRestClient") RestClient restClient, PushChannelProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isEnabledFor(UserRecord recipient) {
    return recipient.pushEnabled();
  }

  @Override
  public ChannelDeliveryResult deliver(
      UserRecord recipient, NotificationRecord notification, Map<String, Object> metadata) {
    if (!properties.isConfigured()) {
      logger.warn("push channel not configured; skipping notificationId={}", notification.notificationId());
      return ChannelDeliveryResult.skipped(NAME, "push not configured");
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("message", flatten(notification));
    try {
      final ResponseEntity<Void> response =
          restClient
              .post()
              .uri(properties.url())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .toBodilessEntity();
      final int status = response.getStatusCode().value();
      logger.info(
          "push sent notificationId={} userId={} status={}",
          notification.notificationId(),
          recipient.userId(),
          status);
      return ChannelDeliveryResult.sent(NAME, String.valueOf(status));
    } catch (RestClientException ex) {
      throw new ChannelDeliveryException("push delivery failed: " + ex.getMessage(), ex);
    }
  }

  static String flatten(NotificationRecord notification) {
    return notification.title() + "\n\n" + notification.message();
  }
}
