package io.cloudburst.burst.ports;

import io.cloudburst.burst.runtime.OrchestratorMetrics;
import io.cloudburst.burst.runtime.TaskKind;

/**
 * Abstraction for metrics updates emitted by the orchestrator.
 */
public interface MetricsPort {

  /**
   * Publish the state of the orchestrator at the end of a cycle.
   */
  void update(OrchestratorMetrics metrics);

  /**
   * A start or stop task was given up on and needs an operator.
   */
  void taskEscalated(TaskKind kind, String vmId);

  static MetricsPort noop() {
    return new MetricsPort() {
      @Override
      public void update(OrchestratorMetrics metrics) {
      }

      @Override
      public void taskEscalated(TaskKind kind, String vmId) {
      }
    };
  }
}
