package io.cloudburst.burst.model;

/**
 * Lifecycle of a cloud VM as seen by the orchestrator.
 */
public enum VmState {
  /** Start requested from the cloud provider, not confirmed yet. */
  STARTING,
  /** Running and connected to the network, not yet accepting jobs. */
  UP,
  /** Announced through the readiness handshake; can run jobs. */
  READY,
  /** Stop requested; waiting for the provider to confirm. */
  STOPPING,
  /** Stopped for good. */
  DOWN,
  /** Unexpected state reported by the provider. */
  OTHER;

  public boolean canTransitionTo(VmState next) {
    if (next == OTHER) {
      return this != DOWN;
    }
    return switch (this) {
      case STARTING -> next == UP || next == READY || next == STOPPING || next == DOWN;
      case UP -> next == READY || next == STOPPING || next == DOWN;
      case READY -> next == STOPPING;
      case STOPPING -> next == DOWN;
      case OTHER -> next == STOPPING || next == DOWN;
      case DOWN -> false;
    };
  }

  /**
   * {@code true} if the VM is up or will soon be.
   */
  public boolean isAlive() {
    return this == STARTING || this == UP;
  }
}
