/*
 * Where: Deadline domain model
 * What: Snapshot of an academic_years row
 * Why: The monitor evaluates windows and escalation per academic year
 */
package com.example.deadline.model;

import java.time.Instant;

public record AcademicYear(
    String academicYearId,
    String name,
    Instant startDate,
    Instant endDate,
    boolean active,
    boolean uploadWindowOpen,
    boolean evaluationWindowOpen) {

  public boolean isWindowOpen(WindowType windowType) {
    return windowType == WindowType.UPLOAD ? uploadWindowOpen : evaluationWindowOpen;
  }

  public AcademicYear withWindowOpen(WindowType windowType, boolean open) {
    return windowType == WindowType.UPLOAD
        ? new AcademicYear(academicYearId, name, startDate, endDate, active, open, evaluationWindowOpen)
        : new AcademicYear(academicYearId, name, startDate, endDate, active, uploadWindowOpen, open);
  }
}
