/*
 * Where: Deadline infrastructure configuration
 * What: Thread pools for recurring jobs and per-channel delivery workers
 * Why: Jobs must not wait on each other and channel calls must not block a job thread unbounded
 */
package com.example.deadline.config;

import com.example.deadline.service.channel.ChannelExecutors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

  @Bean(destroyMethod = "shutdown")
  public ThreadPoolTaskScheduler jobTaskScheduler(SchedulerProperties properties) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix("deadline-job-");
    // in-flight runs finish on shutdown; stop only prevents future firings
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }

  @Bean(destroyMethod = "shutdown")
  public ChannelExecutors channelExecutors(DeliveryProperties properties) {
    return new ChannelExecutors(properties.channelThreads());
  }
}
