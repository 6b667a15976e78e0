package io.cloudburst.burst.ports;

import io.cloudburst.burst.model.JobInfo;
import io.cloudburst.burst.model.VmInfo;
import java.util.Collection;
import java.util.Map;

/**
 * Read-only view of the orchestrator state handed to {@link BurstPolicy} implementations.
 * Returned collections are unmodifiable snapshots.
 */
public interface OrchestratorView {

  /**
   * Pending jobs flagged as cloud candidates, keyed by job id.
   */
  Map<String, JobInfo> candidates();

  /**
   * VMs that were started successfully and are not being stopped.
   */
  Collection<VmInfo> activeVms();

  int maxVms();
}
