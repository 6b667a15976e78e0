package io.cloudburst.burst.model;

/**
 * State of a job as reported by the batch system.
 */
public enum JobState {
  /** Waiting in the batch queue. */
  PENDING,
  /** Executing on some node; {@link JobInfo#execNodeName()} names it. */
  RUNNING,
  /** Done; the exec node it used is clear for re-use. */
  FINISHED,
  /** Unexpected or unhandled state, usually an error in the batch system. */
  OTHER
}
