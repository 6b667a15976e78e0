package io.cloudburst.burst.runtime;

/**
 * Snapshot of the orchestrator state published at the end of every cycle.
 * Counters are cumulative since the orchestrator was created.
 */
public record OrchestratorMetrics(
    long cycle,
    int candidates,
    int pendingAuth,
    int starting,
    int active,
    int ready,
    int stopping,
    long startsRequested,
    long stopsRequested,
    long vmsStopped,
    long startFailures,
    long stopFailures,
    long taskTimeouts,
    long escalations
) {

  public static OrchestratorMetrics empty() {
    return new OrchestratorMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
  }
}
