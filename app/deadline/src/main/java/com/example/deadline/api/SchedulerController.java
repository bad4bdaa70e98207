/*
 * Where: Deadline control API
 * What: Scheduler status and the initialize/stop/trigger actions
 * Why: Operators run sweeps on demand through the same code path as scheduled runs
 */
package com.example.deadline.api;

import com.example.deadline.api.request.SchedulerActionRequest;
import com.example.deadline.api.response.SchedulerActionResponse;
import com.example.deadline.api.response.SchedulerStatusResponse;
import com.example.deadline.service.scheduler.JobScheduler;
import com.example.deadline.service.scheduler.SchedulerBootstrap;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerController.class);

  private final JobScheduler jobScheduler;
  private final SchedulerBootstrap schedulerBootstrap;

  @GetMapping
  public ResponseEntity<SchedulerStatusResponse> status() {
    return ResponseEntity.ok(SchedulerStatusResponse.from(jobScheduler.getStatus()));
  }

  @PostMapping
  public ResponseEntity<SchedulerActionResponse> perform(
      @Valid @RequestBody SchedulerActionRequest request) {
    final String message =
        switch (request.action()) {
          case "initialize" -> {
            final int started = schedulerBootstrap.initialize();
            yield "Scheduler initialized successfully (started " + started + " job(s))";
          }
          case "stop" -> {
            jobScheduler.stopAllJobs();
            yield "All jobs stopped successfully";
          }
          case "trigger-deadline-checks" ->
              "Deadline checks triggered successfully: "
                  + jobScheduler.triggerNow(SchedulerBootstrap.DEADLINE_CHECKS);
          case "trigger-notifications" ->
              "Notification processing triggered successfully: "
                  + jobScheduler.triggerNow(SchedulerBootstrap.NOTIFICATION_PROCESSING);
          default -> throw new IllegalArgumentException("Invalid action: " + request.action());
        };
    logger.info("scheduler action performed action={}", request.action());
    return ResponseEntity.ok(new SchedulerActionResponse(message));
  }
}
