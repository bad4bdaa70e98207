package com.example.deadline.service.scheduler;

import java.util.List;

public record SchedulerStatus(int totalJobs, List<JobStatus> jobs) {

  public SchedulerStatus {
    jobs = List.copyOf(jobs);
  }
}
