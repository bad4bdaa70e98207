/*
 * Where: Deadline delivery channels
 * What: Outcome of one channel attempt for one notification
 * Why: Channel failures are aggregated as values so one channel never aborts another
 */
package com.example.deadline.service.channel;

public record ChannelDeliveryResult(String channel, ChannelStatus status, String detail) {

  public static ChannelDeliveryResult sent(String channel, String detail) {
    return new ChannelDeliveryResult(channel, ChannelStatus.SENT, detail);
  }

  public static ChannelDeliveryResult failed(String channel, String detail) {
    return new ChannelDeliveryResult(channel, ChannelStatus.FAILED, detail);
  }

  public static ChannelDeliveryResult skipped(String channel, String detail) {
    return new ChannelDeliveryResult(channel, ChannelStatus.SKIPPED, detail);
  }

  public boolean isSent() {
    return status == ChannelStatus.SENT;
  }
}
