package com.example.deadline.api.request;

import jakarta.validation.constraints.NotBlank;

public record SchedulerActionRequest(@NotBlank String action) {}
