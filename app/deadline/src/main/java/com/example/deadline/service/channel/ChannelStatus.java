package com.example.deadline.service.channel;

public enum ChannelStatus {
  SENT,
  FAILED,
  /** Channel disabled for the recipient or not configured. */
  SKIPPED
}
