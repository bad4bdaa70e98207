/*
 * Where: Deadline delivery channel tests
 * What: Email channel skip paths, message assembly and error mapping with a mocked JavaMailSender
 * Why: An unconfigured mailer must skip quietly while a refusing one must fail the attempt
 */
package com.example.deadline.service.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.deadline.config.EmailChannelProperties;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.NotificationType;
import com.example.deadline.model.UserRecord;
import com.example.deadline.model.UserRole;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.time.Instant;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class EmailNotificationChannelTest {

  private static final UserRecord RECIPIENT =
      new UserRecord("u-1", "Uma", "uma@example.edu", UserRole.SUBMITTER, true, true, false, 7);
  private static final NotificationRecord NOTIFICATION =
      new NotificationRecord(
          UUID.randomUUID(),
          "u-1",
          NotificationType.SYSTEM_ALERT,
          "Escalation Alert",
          "Please review",
          null,
          "{}",
          Instant.parse("2025-06-27T00:00:00Z"),
          null,
          false);

  @Mock private ObjectProvider<JavaMailSender> mailSenderProvider;
  @Mock private JavaMailSender mailSender;

  @Test
  void sendsHtmlMailToRecipient() throws Exception {
    when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);
    when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));

    final ChannelDeliveryResult result = channel(true).deliver(RECIPIENT, NOTIFICATION, Map.of());

    assertThat(result.isSent()).isTrue();
    final ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
    verify(mailSender).send(captor.capture());
    final MimeMessage sent = captor.getValue();
    assertThat(sent.getSubject()).isEqualTo("Escalation Alert");
    assertThat(sent.getAllRecipients()).extracting(Object::toString).containsExactly("uma@example.edu");
    assertThat(sent.getFrom()).extracting(Object::toString).containsExactly("noreply@example.edu");
  }

  @Test
  void mailerRefusalBecomesChannelFailure() {
    when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);
    when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));
    doThrow(new MailSendException("relay denied")).when(mailSender).send(any(MimeMessage.class));

    assertThatThrownBy(() -> channel(true).deliver(RECIPIENT, NOTIFICATION, Map.of()))
        .isInstanceOf(ChannelDeliveryException.class)
        .hasMessageContaining("relay denied");
  }

  @Test
  void disabledChannelSkips() {
    when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);

    final ChannelDeliveryResult result = channel(false).deliver(RECIPIENT, NOTIFICATION, Map.of());

    assertThat(result.status()).isEqualTo(ChannelStatus.SKIPPED);
    verify(mailSender, never()).send(any(MimeMessage.class));
  }

  @Test
  void missingMailSenderSkips() {
    when(mailSenderProvider.getIfAvailable()).thenReturn(null);

    assertThat(channel(true).deliver(RECIPIENT, NOTIFICATION, Map.of()).status())
        .isEqualTo(ChannelStatus.SKIPPED);
  }

  @Test
  void blankAddressSkips() {
    when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);
    final UserRecord noEmail =
        new UserRecord("u-2", "Ola", " ", UserRole.SUBMITTER, true, true, false, 7);

    assertThat(channel(true).deliver(noEmail, NOTIFICATION, Map.of()).detail())
        .isEqualTo("no email address");
  }

  private EmailNotificationChannel channel(boolean enabled) {
    final EmailChannelProperties properties =
        new EmailChannelProperties(enabled, "noreply@example.edu", "QA System");
    return new EmailNotificationChannel(
        mailSenderProvider, properties, new EmailTemplateRenderer(properties));
  }
}
