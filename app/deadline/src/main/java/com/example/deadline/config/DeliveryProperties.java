/*
 * Where: Deadline configuration binding
 * What: Pending flush batch size and per-channel delivery bounds
 * Why: A stalled channel must not hold a sweep longer than the configured timeout
 */
package com.example.deadline.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "deadline.delivery")
@Validated
public record DeliveryProperties(
    @Positive int batchSize, @NotNull Duration channelTimeout, @Positive int channelThreads) {

  @AssertTrue(message = "deadline.delivery.channel-timeout must be positive")
  public boolean isChannelTimeoutPositive() {
    return channelTimeout == null || (!channelTimeout.isZero() && !channelTimeout.isNegative());
  }
}
