package com.example.deadline;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.deadline.service.scheduler.JobScheduler;
import com.example.deadline.service.scheduler.JobStatus;
import com.example.deadline.service.scheduler.SchedulerBootstrap;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeadlineApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private JobScheduler jobScheduler;

  @Test
  void defaultJobsAreRegisteredButNotArmedWhenSchedulingIsDisabled() {
    assertThat(jobScheduler.getStatus().jobs())
        .extracting(JobStatus::name)
        .contains(
            SchedulerBootstrap.DEADLINE_CHECKS,
            SchedulerBootstrap.NOTIFICATION_PROCESSING,
            SchedulerBootstrap.DAILY_CLEANUP,
            SchedulerBootstrap.WEEKLY_REMINDERS);
    assertThat(jobScheduler.getStatus().jobs())
        .filteredOn(job -> job.name().equals(SchedulerBootstrap.DEADLINE_CHECKS))
        .allSatisfy(job -> assertThat(job.active()).isFalse());
  }
}
