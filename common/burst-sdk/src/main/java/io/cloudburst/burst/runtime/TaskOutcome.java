package io.cloudburst.burst.runtime;

import io.cloudburst.burst.model.VmInfo;
import java.util.Objects;

/**
 * Result of one start or stop task, handed from a worker thread to the main loop.
 */
public record TaskOutcome(TaskKind kind, VmInfo vm, Status status, Throwable error, int attempt) {

  public enum Status {
    SUCCEEDED,
    FAILED,
    /** The task did not finish before its deadline and was cancelled. */
    TIMED_OUT
  }

  public TaskOutcome {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(vm, "vm");
    Objects.requireNonNull(status, "status");
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
  }

  public static TaskOutcome succeeded(TaskKind kind, VmInfo vm, int attempt) {
    return new TaskOutcome(kind, vm, Status.SUCCEEDED, null, attempt);
  }

  public static TaskOutcome failed(TaskKind kind, VmInfo vm, Throwable error, int attempt) {
    return new TaskOutcome(kind, vm, Status.FAILED, error, attempt);
  }

  public static TaskOutcome timedOut(TaskKind kind, VmInfo vm, int attempt) {
    return new TaskOutcome(kind, vm, Status.TIMED_OUT, null, attempt);
  }

  public boolean isSuccess() {
    return status == Status.SUCCEEDED;
  }

  /**
   * Short description of what went wrong, for log lines.
   */
  public String describeError() {
    if (status == Status.TIMED_OUT) {
      return "timed out";
    }
    if (error == null) {
      return "no error";
    }
    return error.getClass().getSimpleName() + ": " + error.getMessage();
  }
}
