package io.cloudburst.burst.runtime;

/**
 * Blocking cloud operations executed off the orchestrator main loop.
 */
public enum TaskKind {
  START,
  STOP
}
