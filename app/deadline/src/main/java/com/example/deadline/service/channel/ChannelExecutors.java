/*
 * Where: Deadline channel delivery
 * What: One bounded worker pool per delivery channel
 * Why: A stalled provider may exhaust only its own workers, never those of another channel
 */
package com.example.deadline.service.channel;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class ChannelExecutors {

  private final int threadsPerChannel;
  private final ConcurrentMap<String, ExecutorService> executors = new ConcurrentHashMap<>();

  public ChannelExecutors(int threadsPerChannel) {
    if (threadsPerChannel <= 0) {
      throw new IllegalArgumentException("threadsPerChannel must be positive");
    }
    this.threadsPerChannel = threadsPerChannel;
  }

  public ExecutorService forChannel(String channelName) {
    return executors.computeIfAbsent(channelName, this::create);
  }

  /** Interrupts in-flight attempts; used on context shutdown. */
  public void shutdown() {
    final List<ExecutorService> all = List.copyOf(executors.values());
    executors.clear();
    all.forEach(ExecutorService::shutdownNow);
  }

  private ExecutorService create(String channelName) {
    return Executors.newFixedThreadPool(
        threadsPerChannel,
        new ThreadFactoryBuilder()
            .setNameFormat("deadline-channel-" + channelName + "-%d")
            .setDaemon(true)
            .build());
  }
}
