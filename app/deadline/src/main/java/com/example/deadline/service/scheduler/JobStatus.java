package com.example.deadline.service.scheduler;

import java.time.Duration;
import java.time.Instant;

/** {@code interval} is null for one-shot jobs, {@code runAt} is null for recurring ones. */
public record JobStatus(
    String name, Duration interval, Instant runAt, boolean active, Instant lastRunAt, boolean lastRunFailed) {}
