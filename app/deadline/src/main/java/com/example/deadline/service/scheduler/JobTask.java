package com.example.deadline.service.scheduler;

/** Body of a scheduled job. The returned text describes the run for logs and manual triggers. */
@FunctionalInterface
public interface JobTask {

  String run();
}
