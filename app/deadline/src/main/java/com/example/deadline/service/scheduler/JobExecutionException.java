package com.example.deadline.service.scheduler;

/** A manually triggered job failed; the cause is the task's own exception. */
public class JobExecutionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String jobName;

  public JobExecutionException(String jobName, Throwable cause) {
    super("job " + jobName + " failed: " + cause.getMessage(), cause);
    this.jobName = jobName;
  }

  public String getJobName() {
    return jobName;
  }
}
