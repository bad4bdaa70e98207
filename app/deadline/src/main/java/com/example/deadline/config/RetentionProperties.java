/*
 * Where: Deadline configuration binding
 * What: Retention policy of read notifications
 * Why: Keep the table bounded without touching history used for dedup
 */
package com.example.deadline.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "deadline.retention")
@Validated
public record RetentionProperties(boolean enabled, @PositiveOrZero int retentionDays) {}
