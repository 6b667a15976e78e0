package io.cloudburst.burst.model;

import java.time.Instant;

/**
 * Point-in-time snapshot of one batch-queue job.
 * <p>
 * Records are rebuilt from every batch-system poll. Construction enforces the contract the
 * orchestrator relies on: a non-blank job id, a state, and an exec node name for running jobs.
 * A record that breaks it never enters the system.
 */
public record JobInfo(
    String jobId,
    JobState state,
    String execNodeName,
    Instant submittedAt,
    Instant runningAt,
    String queue
) {

  public JobInfo {
    if (jobId == null || jobId.isBlank()) {
      throw new IllegalArgumentException("job record is missing required field 'jobId'");
    }
    if (state == null) {
      throw new IllegalArgumentException("job " + jobId + " is missing required field 'state'");
    }
    if (state == JobState.RUNNING && (execNodeName == null || execNodeName.isBlank())) {
      throw new IllegalArgumentException(
          "job " + jobId + " is RUNNING but missing required field 'execNodeName'");
    }
  }

  public static JobInfo pending(String jobId, Instant submittedAt) {
    return new JobInfo(jobId, JobState.PENDING, null, submittedAt, null, null);
  }

  public static JobInfo running(String jobId, String execNodeName, Instant runningAt) {
    return new JobInfo(jobId, JobState.RUNNING, execNodeName, null, runningAt, null);
  }

  public static JobInfo finished(String jobId) {
    return new JobInfo(jobId, JobState.FINISHED, null, null, null, null);
  }

  public boolean isRunning() {
    return state == JobState.RUNNING;
  }

  public boolean isPending() {
    return state == JobState.PENDING;
  }

  @Override
  public String toString() {
    return "Job " + jobId;
  }
}
