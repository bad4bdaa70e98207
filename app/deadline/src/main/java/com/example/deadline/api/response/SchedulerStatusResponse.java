/*
 * Where: Deadline API response
 * What: Scheduler status as exposed on the control surface
 * Why: Operators see which jobs exist and which are armed
 */
package com.example.deadline.api.response;

import com.example.deadline.service.scheduler.JobStatus;
import com.example.deadline.service.scheduler.SchedulerStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SchedulerStatusResponse(int totalJobs, List<Job> jobs) {

  public SchedulerStatusResponse {
    jobs = List.copyOf(jobs);
  }

  public static SchedulerStatusResponse from(SchedulerStatus status) {
    return new SchedulerStatusResponse(
        status.totalJobs(), status.jobs().stream().map(Job::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Job(
      String name,
      Long intervalSeconds,
      Instant runAt,
      boolean running,
      Instant lastRunAt,
      boolean lastRunFailed) {

    static Job from(JobStatus status) {
      return new Job(
          status.name(),
          status.interval() == null ? null : status.interval().toSeconds(),
          status.runAt(),
          status.active(),
          status.lastRunAt(),
          status.lastRunFailed());
    }
  }
}
