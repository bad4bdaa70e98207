/*
 * Where: Deadline domain model
 * What: An unevaluated evidence row joined with its indicator hierarchy
 * Why: Escalation groups these by owner and level 4 reports them item by item
 */
package com.example.deadline.model;

import java.time.Instant;

public record OverdueEvidence(
    String evidenceId,
    String fileName,
    String uploaderName,
    String ownerId,
    String subIndicatorName,
    String indicatorName,
    String standardName,
    String educationLevelName,
    Instant uploadedAt) {}
