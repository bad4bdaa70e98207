/*
 * Where: Deadline delivery channel tests
 * What: Push channel request shape and failure mapping against a mocked HTTP server
 * Why: Provider rejections must surface as channel failures, not as silent success
 */
package com.example.deadline.service.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.deadline.config.PushChannelProperties;
import com.example.deadline.model.NotificationRecord;
import com.example.deadline.model.NotificationType;
import com.example.deadline.model.UserRecord;
import com.example.deadline.model.UserRole;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class PushNotificationChannelTest {

  private static final String URL = "https://push.example.test/api/notify";
  private static final UserRecord RECIPIENT =
      new UserRecord("u-1", "Uma", "uma@example.edu", UserRole.SUBMITTER, true, true, true, 7);
  private static final NotificationRecord NOTIFICATION =
      new NotificationRecord(
          UUID.randomUUID(),
          "u-1",
          NotificationType.UPLOAD_DEADLINE_REMINDER,
          "Upload Deadline Reminder - 2025",
          "Closes in 3 day(s)",
          null,
          "{}",
          Instant.parse("2025-06-27T00:00:00Z"),
          null,
          false);

  private MockRestServiceServer server;
  private RestClient restClient;

  @BeforeEach
  void setUp() {
    final RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    restClient = builder.build();
  }

  @Test
  void postsFlattenedMessageWithBearerToken() {
    server
        .expect(requestTo(URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret"))
        .andExpect(content().formDataContains(Map.of("message", "Upload Deadline Reminder - 2025\n\nCloses in 3 day(s)")))
        .andRespond(withSuccess());

    final ChannelDeliveryResult result = channel("secret").deliver(RECIPIENT, NOTIFICATION, Map.of());

    assertThat(result.isSent()).isTrue();
    assertThat(result.detail()).isEqualTo("200");
    server.verify();
  }

  @Test
  void providerErrorBecomesChannelFailure() {
    server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> channel("secret").deliver(RECIPIENT, NOTIFICATION, Map.of()))
        .isInstanceOf(ChannelDeliveryException.class)
        .hasMessageStartingWith("push delivery failed");
  }

  @Test
  void missingTokenSkipsWithoutCallingProvider() {
    final ChannelDeliveryResult result = channel("").deliver(RECIPIENT, NOTIFICATION, Map.of());

    assertThat(result.status()).isEqualTo(ChannelStatus.SKIPPED);
    server.verify();
  }

  @Test
  void followsRecipientPreference() {
    final UserRecord optedOut =
        new UserRecord("u-2", "Ola", "ola@example.edu", UserRole.SUBMITTER, true, true, false, 7);

    assertThat(channel("secret").isEnabledFor(RECIPIENT)).isTrue();
    assertThat(channel("secret").isEnabledFor(optedOut)).isFalse();
  }

  private PushNotificationChannel channel(String token) {
    return new PushNotificationChannel(restClient, new PushChannelProperties(URL, token, null, null));
  }
}
