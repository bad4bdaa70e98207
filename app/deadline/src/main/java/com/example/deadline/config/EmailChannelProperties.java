/*
 * Where: Deadline configuration binding
 * What: Settings of the email channel
 * Why: Sender identity differs per environment; SMTP itself is configured under spring.mail
 */
package com.example.deadline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "deadline.channels.email")
public record EmailChannelProperties(boolean enabled, String from, String systemName) {

  public EmailChannelProperties {
    from = from == null || from.isBlank() ? "noreply@evidencemanagement.com" : from;
    systemName = systemName == null || systemName.isBlank() ? "Evidence Management System" : systemName;
  }
}
