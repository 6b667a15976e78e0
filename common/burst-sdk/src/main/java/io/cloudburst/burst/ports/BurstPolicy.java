package io.cloudburst.burst.ports;

import io.cloudburst.burst.model.JobInfo;
import io.cloudburst.burst.model.VmInfo;

/**
 * Deployment-specific policy deciding when the VM pool grows and shrinks.
 * <p>
 * Implementations may read, but must not mutate, the records and view they are given.
 */
public interface BurstPolicy {

  /**
   * Return {@code true} if the given pending job may run on a cloud VM.
   */
  boolean isCloudCandidate(JobInfo job);

  /**
   * Decide whether a new VM should be started this cycle. By default a VM is needed as
   * long as there is at least one candidate job.
   */
  default boolean isNewVmNeeded(OrchestratorView view) {
    return !view.candidates().isEmpty();
  }

  /**
   * Return {@code true} if the given ready VM is no longer needed and can be stopped.
   */
  boolean canVmBeStopped(VmInfo vm, OrchestratorView view);
}
