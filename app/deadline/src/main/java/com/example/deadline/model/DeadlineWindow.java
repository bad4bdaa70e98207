/*
 * Where: Deadline domain model
 * What: Result of evaluating an academic year against the current time
 * Why: Reminder, transition and escalation decisions all start from these numbers
 */
package com.example.deadline.model;

public record DeadlineWindow(
    long daysUntilClose, long daysSinceClose, boolean closed, boolean shouldBeOpen) {}
