package io.cloudburst.burst.ports;

/**
 * Callbacks around each orchestrator cycle, mainly for simulators and tests.
 */
public interface CycleHook {

  CycleHook NONE = new CycleHook() {
  };

  default void beforeCycle(long cycle) {
  }

  default void afterCycle(long cycle) {
  }
}
