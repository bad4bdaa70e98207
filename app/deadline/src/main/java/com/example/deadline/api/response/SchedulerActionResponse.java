package com.example.deadline.api.response;

public record SchedulerActionResponse(String message) {}
