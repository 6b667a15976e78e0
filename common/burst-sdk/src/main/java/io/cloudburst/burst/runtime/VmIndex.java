package io.cloudburst.burst.runtime;

import io.cloudburst.burst.model.VmInfo;
import io.cloudburst.burst.model.VmState;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup structures over the VM records of one orchestrator.
 * <p>
 * A record lives in exactly one of three phase maps: <em>staged</em> (start requested, not
 * confirmed), <em>active</em> (started, not being stopped) or <em>stopping</em>. Records that
 * still wait for their readiness handshake are also indexed by auth token, and ready records
 * by node name. Every map is guarded by this object's monitor, so each method is one atomic
 * step and there is no lock ordering to observe. Callers may lock a {@link VmInfo} while
 * holding this monitor, never the other way round.
 */
public final class VmIndex {

  public enum StartConfirmation {
    /** Moved from staged to active. */
    ACTIVATED,
    /** Already active because the VM reported ready before the start call returned. */
    ALREADY_ACTIVE,
    /** The record is no longer staged, for example because it is being stopped. */
    NOT_STAGED
  }

  public enum ReadinessOutcome {
    ACCEPTED,
    UNKNOWN_TOKEN,
    NODE_NAME_IN_USE,
    NOT_BOOTING
  }

  public record Readiness(ReadinessOutcome outcome, VmInfo vm) {
  }

  private final Map<String, VmInfo> pendingAuth = new HashMap<>();
  private final Map<String, VmInfo> staged = new LinkedHashMap<>();
  private final Map<String, VmInfo> active = new LinkedHashMap<>();
  private final Map<String, VmInfo> stopping = new LinkedHashMap<>();
  private final Map<String, VmInfo> byNode = new HashMap<>();

  /**
   * Registers a freshly created record whose start is about to be requested.
   */
  public synchronized void registerStarting(VmInfo vm) {
    Objects.requireNonNull(vm, "vm");
    String token = vm.getAuthToken()
        .orElseThrow(() -> new IllegalArgumentException(vm + " has no auth token"));
    String vmId = vm.getVmId();
    if (staged.containsKey(vmId) || active.containsKey(vmId) || stopping.containsKey(vmId)) {
      throw new IllegalStateException("VM id " + vmId + " is already tracked");
    }
    if (pendingAuth.containsKey(token)) {
      throw new IllegalStateException("auth token for " + vm + " is already in use");
    }
    pendingAuth.put(token, vm);
    staged.put(vmId, vm);
  }

  public synchronized StartConfirmation confirmStarted(VmInfo vm) {
    String vmId = vm.getVmId();
    if (staged.remove(vmId) != null) {
      active.put(vmId, vm);
      return StartConfirmation.ACTIVATED;
    }
    if (active.get(vmId) == vm) {
      return StartConfirmation.ALREADY_ACTIVE;
    }
    return StartConfirmation.NOT_STAGED;
  }

  /**
   * Forgets a record whose start failed: it leaves the staged map and its token is revoked.
   * A record that is no longer staged, for example because it reported ready in the
   * meantime, is left untouched.
   *
   * @return {@code false} if the record was not staged
   */
  public synchronized boolean discardStart(VmInfo vm) {
    if (staged.remove(vm.getVmId()) == null) {
      return false;
    }
    revokeToken(vm);
    return true;
  }

  /**
   * Completes the readiness handshake for the VM holding {@code token}. The token is
   * consumed, the VM becomes READY under {@code nodeName} and a VM whose start call has not
   * returned yet is promoted to active.
   */
  public synchronized Readiness acceptReadiness(String token, String nodeName, Instant at) {
    VmInfo vm = token == null ? null : pendingAuth.get(token);
    if (vm == null) {
      return new Readiness(ReadinessOutcome.UNKNOWN_TOKEN, null);
    }
    VmInfo owner = byNode.get(nodeName);
    if (owner != null && owner != vm) {
      return new Readiness(ReadinessOutcome.NODE_NAME_IN_USE, owner);
    }
    if (!vm.getState().isAlive()) {
      return new Readiness(ReadinessOutcome.NOT_BOOTING, vm);
    }
    pendingAuth.remove(token);
    vm.markReady(nodeName, at);
    if (staged.remove(vm.getVmId()) != null) {
      active.put(vm.getVmId(), vm);
    }
    byNode.put(nodeName, vm);
    return new Readiness(ReadinessOutcome.ACCEPTED, vm);
  }

  /**
   * Moves a staged or active record to the stopping map in one step: the node-name entry
   * and any unused token are dropped, and the record becomes STOPPING. A readiness
   * notification racing with this call either completes before it or finds no token.
   *
   * @return {@code false} if the record was neither staged nor active
   */
  public synchronized boolean moveToStopping(VmInfo vm) {
    String vmId = vm.getVmId();
    VmInfo removed = active.remove(vmId);
    if (removed == null) {
      removed = staged.remove(vmId);
    }
    if (removed == null) {
      return false;
    }
    revokeToken(vm);
    vm.getNodeName().ifPresent(node -> byNode.remove(node, vm));
    vm.transitionTo(VmState.STOPPING);
    stopping.put(vmId, vm);
    return true;
  }

  public synchronized boolean completeStop(VmInfo vm) {
    return stopping.remove(vm.getVmId()) != null;
  }

  public synchronized Optional<VmInfo> findByNode(String nodeName) {
    return Optional.ofNullable(byNode.get(nodeName));
  }

  public synchronized List<VmInfo> activeVms() {
    return List.copyOf(active.values());
  }

  public synchronized List<VmInfo> readyVms() {
    return List.copyOf(byNode.values());
  }

  public synchronized List<VmInfo> stagedVms() {
    return List.copyOf(staged.values());
  }

  public synchronized List<VmInfo> stoppingVms() {
    return List.copyOf(stopping.values());
  }

  public synchronized boolean isActive(String vmId) {
    return active.containsKey(vmId);
  }

  public synchronized boolean isStopping(String vmId) {
    return stopping.containsKey(vmId);
  }

  public synchronized int pendingAuthCount() {
    return pendingAuth.size();
  }

  public synchronized int activeCount() {
    return active.size();
  }

  public synchronized int readyCount() {
    return byNode.size();
  }

  public synchronized int stagedCount() {
    return staged.size();
  }

  public synchronized int stoppingCount() {
    return stopping.size();
  }

  /**
   * Number of VMs counted against the pool cap: started ones plus those whose start is in
   * flight.
   */
  public synchronized int allocatedCount() {
    return staged.size() + active.size();
  }

  private void revokeToken(VmInfo vm) {
    vm.getAuthToken().ifPresent(token -> pendingAuth.remove(token, vm));
    vm.clearAuthToken();
  }
}
