/*
 * Where: Deadline configuration binding
 * What: Endpoint, token and timeouts of the push channel
 * Why: The push provider is optional; a blank token disables the channel softly
 */
package com.example.deadline.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "deadline.channels.push")
public record PushChannelProperties(
    String url, String token, Duration connectTimeout, Duration readTimeout) {

  public PushChannelProperties {
    url = url == null || url.isBlank() ? "https://notify-api.line.me/api/notify" : url;
    token = token == null ? "" : token.trim();
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }

  public boolean isConfigured() {
    return !token.isEmpty();
  }
}
