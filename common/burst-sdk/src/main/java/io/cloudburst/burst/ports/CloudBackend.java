package io.cloudburst.burst.ports;

import io.cloudburst.burst.model.VmInfo;
import java.util.Collection;

/**
 * Abstraction over the cloud provider that hosts the burst VMs.
 * <p>
 * {@link #start(VmInfo)} and {@link #stop(VmInfo)} may be slow and are only ever invoked
 * from worker threads. {@link #refreshStatus(Collection)} is invoked from the orchestrator
 * main loop with a time bound.
 */
public interface CloudBackend {

  /**
   * Start a new VM for the given record. On success the implementation fills in the
   * cloud-assigned fields of the record (instance id, addresses).
   * <p>
   * The VM must be given the record's auth token so that it can complete the readiness
   * handshake once booted.
   */
  void start(VmInfo vm) throws Exception;

  /**
   * Stop and release the VM backing the given record.
   */
  void stop(VmInfo vm) throws Exception;

  /**
   * Update the state of every given record from the provider's view. Implementations must
   * visit every record; a record the provider does not know about is left unchanged.
   */
  void refreshStatus(Collection<VmInfo> vms) throws Exception;
}
