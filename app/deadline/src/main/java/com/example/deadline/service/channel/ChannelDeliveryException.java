package com.example.deadline.service.channel;

/** Raised by a channel when the provider rejected or could not take the message. */
public class ChannelDeliveryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ChannelDeliveryException(String message) {
    super(message);
  }

  public ChannelDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
