package io.cloudburst.burst.ports;

import io.cloudburst.burst.model.JobInfo;
import java.util.List;

/**
 * Port used by the orchestrator to read the state of the batch queue.
 */
public interface BatchQueuePort {

  /**
   * Return a snapshot of every job currently known to the batch system.
   * <p>
   * Called once per cycle. Any exception aborts the current cycle; the orchestrator logs it
   * and tries again on the next one.
   *
   * @return job records, one per job id
   * @throws Exception when the batch system cannot be queried
   */
  List<JobInfo> snapshot() throws Exception;
}
