/*
 * Where: Deadline service layer
 * What: Role-specific count of evaluations a reviewer still owes for a year
 * Why: Internal reviewers answer for owned sub-indicators, external reviewers for every item
 */
package com.example.deadline.service;

import com.example.deadline.model.UserRecord;
import com.example.deadline.repository.EvidenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PendingEvaluationCounter {

  private final EvidenceRepository evidenceRepository;

  public int count(UserRecord reviewer, String academicYearId) {
    return switch (reviewer.role()) {
      case INTERNAL_REVIEWER ->
          evidenceRepository.countUnevaluatedOwnedBy(reviewer.userId(), academicYearId);
      case EXTERNAL_REVIEWER ->
          evidenceRepository.countMissingEvaluationBy(reviewer.userId(), academicYearId);
      default -> 0;
    };
  }
}
