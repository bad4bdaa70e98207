/*
 * Where: Deadline configuration tests
 * What: Binds every deadline.* group from property strings
 * Why: Duration notation and compact-constructor defaults must survive refactors
 */
package com.example.deadline.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class DeadlinePropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "deadline.scheduler.enabled=true",
              "deadline.scheduler.deadline-check-interval=1h",
              "deadline.scheduler.notification-processing-interval=5m",
              "deadline.scheduler.daily-cleanup-interval=24h",
              "deadline.scheduler.weekly-reminder-interval=7d",
              "deadline.scheduler.pool-size=4",
              "deadline.monitor.reminder-dedup-window=24h",
              "deadline.monitor.escalation-cooldown=48h",
              "deadline.monitor.action-base-url=https://qa.example.edu/",
              "deadline.delivery.batch-size=100",
              "deadline.delivery.channel-timeout=10s",
              "deadline.delivery.channel-threads=4",
              "deadline.retention.enabled=true",
              "deadline.retention.retention-days=30");

  @Test
  void bindsDurationsAndDefaults() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final SchedulerProperties scheduler = context.getBean(SchedulerProperties.class);
          final DeadlineMonitorProperties monitor = context.getBean(DeadlineMonitorProperties.class);
          final DeliveryProperties delivery = context.getBean(DeliveryProperties.class);
          final EmailChannelProperties email = context.getBean(EmailChannelProperties.class);
          final PushChannelProperties push = context.getBean(PushChannelProperties.class);

          assertThat(scheduler.deadlineCheckInterval()).isEqualTo(Duration.ofHours(1));
          assertThat(scheduler.notificationProcessingInterval()).isEqualTo(Duration.ofMinutes(5));
          assertThat(scheduler.weeklyReminderInterval()).isEqualTo(Duration.ofDays(7));
          assertThat(monitor.longestDedupWindow()).isEqualTo(Duration.ofHours(48));
          assertThat(monitor.actionUrl("/evaluate")).isEqualTo("https://qa.example.edu/evaluate");
          assertThat(delivery.channelTimeout()).isEqualTo(Duration.ofSeconds(10));
          assertThat(email.from()).isEqualTo("noreply@evidencemanagement.com");
          assertThat(push.isConfigured()).isFalse();
          assertThat(push.readTimeout()).isEqualTo(Duration.ofSeconds(5));
        });
  }

  @Test
  void rejectsNonPositiveInterval() {
    contextRunner
        .withPropertyValues("deadline.scheduler.deadline-check-interval=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsMissingEscalationCooldown() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
        .withUserConfiguration(TestConfiguration.class)
        .withPropertyValues(
            "deadline.scheduler.deadline-check-interval=1h",
            "deadline.scheduler.notification-processing-interval=5m",
            "deadline.scheduler.daily-cleanup-interval=24h",
            "deadline.scheduler.weekly-reminder-interval=7d",
            "deadline.scheduler.pool-size=4",
            "deadline.monitor.reminder-dedup-window=24h",
            "deadline.delivery.batch-size=100",
            "deadline.delivery.channel-timeout=10s",
            "deadline.delivery.channel-threads=4")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    SchedulerProperties.class,
    DeadlineMonitorProperties.class,
    DeliveryProperties.class,
    EmailChannelProperties.class,
    PushChannelProperties.class,
    RetentionProperties.class
  })
  static class TestConfiguration {}
}
