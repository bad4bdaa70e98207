package com.example.deadline.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.deadline.model.NotificationType;
import org.junit.jupiter.api.Test;

class DedupLockKeyGeneratorTest {

  private final DedupLockKeyGenerator generator = new DedupLockKeyGenerator();

  @Test
  void sameKeyGivesSameLock() {
    assertThat(generator.generate("u-1", NotificationType.EVALUATION_OVERDUE, "ay-1"))
        .isEqualTo(generator.generate("u-1", NotificationType.EVALUATION_OVERDUE, "ay-1"));
  }

  @Test
  void eachKeyPartChangesTheLock() {
    final long base = generator.generate("u-1", NotificationType.EVALUATION_OVERDUE, "ay-1");

    assertThat(generator.generate("u-2", NotificationType.EVALUATION_OVERDUE, "ay-1")).isNotEqualTo(base);
    assertThat(generator.generate("u-1", NotificationType.SYSTEM_ALERT, "ay-1")).isNotEqualTo(base);
    assertThat(generator.generate("u-1", NotificationType.EVALUATION_OVERDUE, "ay-2")).isNotEqualTo(base);
  }
}
