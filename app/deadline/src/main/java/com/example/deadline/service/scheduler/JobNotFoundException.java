package com.example.deadline.service.scheduler;

public class JobNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public JobNotFoundException(String jobName) {
    super("job not found: " + jobName);
  }
}
