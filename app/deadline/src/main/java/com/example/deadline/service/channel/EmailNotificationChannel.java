/*
 * Where: Deadline delivery channels
 * What: Sends notifications as HTML mail through Spring's JavaMailSender
 * Why: Email is the default channel for every user who did not opt out
 */
package com.example.deadline.service.channel;

import com.example.deadline.config.EmailChannelProperties;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.UserRecord;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailNotificationChannel implements NotificationChannel {

  private static final Logger logger = LoggerFactory.getLogger(EmailNotificationChannel.class);

  static final String NAME = "email";

  // absent when spring.mail.host is not set
  private final ObjectProvider<JavaMailSender> mailSenderProvider;
  private final EmailChannelProperties properties;
  private final EmailTemplateRenderer renderer;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isEnabledFor(UserRecord recipient) {
    return recipient.emailEnabled();
  }

  @Override
  public ChannelDeliveryResult deliver(
      UserRecord recipient, NotificationRecord notification, Map<String, Object> metadata) {
    final JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
    if (!properties.enabled() || mailSender == null) {
      logger.warn("email channel not configured; skipping notificationId={}", notification.notificationId());
      return ChannelDeliveryResult.skipped(NAME, "email not configured");
    }
    if (recipient.email() == null || recipient.email().isBlank()) {
      logger.warn(
          "recipient has no email address userId={} notificationId={}",
          recipient.userId(),
          notification.notificationId());
      return ChannelDeliveryResult.skipped(NAME, "no email address");
    }
    try {
      final MimeMessage message = mailSender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
      helper.setFrom(properties.from());
      helper.setTo(recipient.email());
      helper.setSubject(notification.title());
      helper.setText(
          renderer.render(notification.title(), notification.message(), metadata), true);
      mailSender.send(message);
      final String messageId = message.getMessageID();
      logger.info(
          "email sent notificationId={} userId={} messageId={}",
          notification.notificationId(),
          recipient.userId(),
          messageId);
      return ChannelDeliveryResult.sent(NAME, messageId == null ? "unknown" : messageId);
    } catch (MessagingException | MailException ex) {
      throw new ChannelDeliveryException("email delivery failed: " + ex.getMessage(), ex);
    }
  }
}
