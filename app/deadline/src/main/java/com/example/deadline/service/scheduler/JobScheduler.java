/*
 * Where: Deadline job scheduling
 * What: Registry of named jobs with fixed-interval or one-shot triggers
 * Why: Jobs are stopped, restarted and triggered by name from the control surface
 */
package com.example.deadline.service.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class JobScheduler {

  private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

  static final String MDC_JOB_NAME = "job_name";

  private final TaskScheduler taskScheduler;
  private final Clock clock;
  private final ConcurrentMap<String, ScheduledJob> jobs = new ConcurrentHashMap<>();

  public JobScheduler(@Qualifier("jobTaskScheduler") TaskScheduler taskScheduler, Clock clock) {
    this.taskScheduler = taskScheduler;
    this.clock = clock;
  }

  /** Registers and arms a recurring job, replacing any job of the same name. */
  public void scheduleJob(String name, Duration interval, JobTask task) {
    register(name, interval, task).arm();
    logger.info("job scheduled name={} interval={}", name, interval);
  }

  /** Registers a recurring job without arming it; {@link #startAll()} or a trigger runs it. */
  public void registerJob(String name, Duration interval, JobTask task) {
    register(name, interval, task);
    logger.info("job registered name={} interval={} active=false", name, interval);
  }

  /** Runs {@code task} once at {@code runAt}; the job removes itself after running. */
  public void scheduleOnce(String name, Instant runAt, JobTask task) {
    final ScheduledJob job = new ScheduledJob(name, null, runAt, task);
    replace(name, job);
    job.arm();
    logger.info("one-shot job scheduled name={} runAt={}", name, runAt);
  }

  public boolean isRegistered(String name) {
    return jobs.containsKey(name);
  }

  /** Prevents future firings; a run already in progress completes. Unknown names are ignored. */
  public void stopJob(String name) {
    final ScheduledJob job = jobs.get(name);
    if (job == null) {
      return;
    }
    if (job.isOneShot()) {
      // a stopped one-shot can never fire again
      jobs.remove(name, job);
    }
    if (job.cancel()) {
      logger.info("job stopped name={}", name);
    }
  }

  public void stopAllJobs() {
    for (String name : List.copyOf(jobs.keySet())) {
      stopJob(name);
    }
  }

  /** Arms every registered recurring job that is not running. */
  public int startAll() {
    int started = 0;
    for (ScheduledJob job : jobs.values()) {
      if (!job.isOneShot() && !job.isActive()) {
        job.arm();
        started++;
        logger.info("job started name={} interval={}", job.name, job.interval);
      }
    }
    return started;
  }

  public SchedulerStatus getStatus() {
    final List<JobStatus> statuses = new ArrayList<>();
    for (ScheduledJob job : jobs.values()) {
      statuses.add(
          new JobStatus(
              job.name, job.interval, job.runAt, job.isActive(), job.lastRunAt, job.lastRunFailed));
    }
    statuses.sort(Comparator.comparing(JobStatus::name));
    return new SchedulerStatus(statuses.size(), statuses);
  }

  /**
   * Runs the job's task on the calling thread, leaving its schedule untouched.
   *
   * @throws JobNotFoundException when no job of that name is registered
   * @throws JobExecutionException when the task fails
   */
  public String triggerNow(String name) {
    final ScheduledJob job = jobs.get(name);
    if (job == null) {
      throw new JobNotFoundException(name);
    }
    logger.info("job triggered manually name={}", name);
    try {
      return job.execute();
    } catch (RuntimeException ex) {
      throw new JobExecutionException(name, ex);
    }
  }

  private ScheduledJob register(String name, Duration interval, JobTask task) {
    if (interval == null || interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("job interval must be positive: " + name);
    }
    final ScheduledJob job = new ScheduledJob(name, interval, null, task);
    replace(name, job);
    return job;
  }

  private void replace(String name, ScheduledJob job) {
    final ScheduledJob previous = jobs.put(name, job);
    if (previous != null) {
      previous.cancel();
      logger.info("job replaced name={}", name);
    }
  }

  /** Scheduled firing: failures are logged and never cancel later firings. */
  private void fire(ScheduledJob job) {
    try {
      final String result = job.execute();
      logger.info("job completed name={} result={}", job.name, result);
    } catch (RuntimeException ex) {
      logger.error("job failed name={}", job.name, ex);
    } finally {
      if (job.isOneShot()) {
        jobs.remove(job.name, job);
      }
    }
  }

  private final class ScheduledJob {

    private final String name;
    private final Duration interval;
    private final Instant runAt;
    private final JobTask task;
    private volatile ScheduledFuture<?> future;
    private volatile Instant lastRunAt;
    private volatile boolean lastRunFailed;

    private ScheduledJob(String name, Duration interval, Instant runAt, JobTask task) {
      this.name = name;
      this.interval = interval;
      this.runAt = runAt;
      this.task = task;
    }

    private boolean isOneShot() {
      return interval == null;
    }

    private synchronized void arm() {
      if (isActive()) {
        return;
      }
      if (isOneShot()) {
        future = taskScheduler.schedule(() -> fire(this), runAt);
      } else {
        // first firing one interval from now, like a fresh cron registration
        future =
            taskScheduler.scheduleAtFixedRate(
                () -> fire(this), Instant.now(clock).plus(interval), interval);
      }
    }

    private synchronized boolean cancel() {
      final ScheduledFuture<?> current = future;
      future = null;
      return current != null && current.cancel(false);
    }

    private boolean isActive() {
      final ScheduledFuture<?> current = future;
      return current != null && !current.isDone();
    }

    private String execute() {
      MDC.put(MDC_JOB_NAME, name);
      lastRunAt = Instant.now(clock);
      try {
        final String result = task.run();
        lastRunFailed = false;
        return result;
      } catch (RuntimeException ex) {
        lastRunFailed = true;
        throw ex;
      } finally {
        MDC.remove(MDC_JOB_NAME);
      }
    }
  }
}
