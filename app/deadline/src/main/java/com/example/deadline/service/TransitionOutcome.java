package com.example.deadline.service;

import com.example.deadline.model.AcademicYear;

/** Academic year with the flags as they stand after transition checks, plus what was issued. */
public record TransitionOutcome(AcademicYear year, int notificationsCreated) {}
