package io.cloudburst.burst.runtime;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of the orchestrator.
 *
 * @param maxVms               hard cap on the number of VMs allocated at the same time
 * @param maxDelta             intended cap on VMs started per cycle; accepted but at most one
 *                             VM is started per cycle
 * @param workerThreads        size of the pool running start/stop operations
 * @param taskDeadline         how long a start/stop operation may run before it is cancelled;
 *                             zero disables the deadline
 * @param statusRefreshTimeout upper bound on the cloud status poll in the main loop
 * @param readyTimeout         how long a started VM may take to report ready before it is
 *                             stopped; zero disables the check
 * @param stopRetries          how many times a failed stop is retried before an operator alert
 */
public record OrchestratorSettings(
    int maxVms,
    int maxDelta,
    int workerThreads,
    Duration taskDeadline,
    Duration statusRefreshTimeout,
    Duration readyTimeout,
    int stopRetries
) {

  public OrchestratorSettings {
    if (maxVms < 0) {
      throw new IllegalArgumentException("maxVms must be >= 0");
    }
    if (maxDelta < 1) {
      throw new IllegalArgumentException("maxDelta must be >= 1");
    }
    if (workerThreads < 1) {
      throw new IllegalArgumentException("workerThreads must be >= 1");
    }
    Objects.requireNonNull(taskDeadline, "taskDeadline");
    Objects.requireNonNull(statusRefreshTimeout, "statusRefreshTimeout");
    Objects.requireNonNull(readyTimeout, "readyTimeout");
    if (taskDeadline.isNegative() || readyTimeout.isNegative()) {
      throw new IllegalArgumentException("timeouts must not be negative");
    }
    if (statusRefreshTimeout.isNegative() || statusRefreshTimeout.isZero()) {
      throw new IllegalArgumentException("statusRefreshTimeout must be positive");
    }
    if (stopRetries < 0) {
      throw new IllegalArgumentException("stopRetries must be >= 0");
    }
  }

  public static OrchestratorSettings defaults(int maxVms) {
    return new OrchestratorSettings(
        maxVms,
        1,
        8,
        Duration.ofMinutes(10),
        Duration.ofSeconds(30),
        Duration.ofMinutes(15),
        1);
  }
}
