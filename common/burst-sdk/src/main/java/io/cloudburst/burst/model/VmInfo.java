package io.cloudburst.burst.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle record of one cloud VM.
 * <p>
 * Instances are owned by the orchestrator. They are touched by the main loop, by the
 * readiness handshake and by the cloud backend while a start, stop or status call for the
 * record is running, so every accessor is synchronized.
 */
public final class VmInfo {

  private final String vmId;
  private VmState state;
  private String authToken;
  private Instant startedAt;
  private Instant readyAt;
  private Instant stoppedAt;
  private Duration totalIdle = Duration.ZERO;
  private Duration lastIdle = Duration.ZERO;
  private final Set<String> jobs = new LinkedHashSet<>();
  private String nodeName;
  private String cloudId;
  private String publicIp;
  private String privateIp;
  private double bill;
  private boolean abandoned;

  public VmInfo(String vmId, String authToken) {
    if (vmId == null || vmId.isBlank()) {
      throw new IllegalArgumentException("VM record is missing required field 'vmId'");
    }
    this.vmId = vmId;
    this.authToken = Objects.requireNonNull(authToken, "authToken");
    this.state = VmState.STARTING;
  }

  public String getVmId() {
    return vmId;
  }

  public synchronized VmState getState() {
    return state;
  }

  public synchronized void transitionTo(VmState next) {
    if (state == next) {
      return;
    }
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("Cannot transition " + this + " from " + state + " to " + next);
    }
    this.state = next;
  }

  /**
   * Moves to {@code next} only if the VM is currently in {@code expected}.
   *
   * @return whether the transition happened
   */
  public synchronized boolean transitionIfIn(VmState expected, VmState next) {
    if (state != expected) {
      return false;
    }
    transitionTo(next);
    return true;
  }

  public synchronized Optional<String> getAuthToken() {
    return Optional.ofNullable(authToken);
  }

  public synchronized void clearAuthToken() {
    this.authToken = null;
  }

  /**
   * Completes the readiness handshake for this VM: the token is consumed and the VM
   * becomes {@link VmState#READY} under the given node name.
   */
  public synchronized void markReady(String nodeName, Instant at) {
    if (nodeName == null || nodeName.isBlank()) {
      throw new IllegalArgumentException("nodeName must not be blank");
    }
    transitionTo(VmState.READY);
    this.nodeName = nodeName;
    this.readyAt = at;
    this.authToken = null;
  }

  public synchronized void markStarted(Instant at) {
    this.startedAt = at;
  }

  public synchronized void markStopped(Instant at) {
    this.stoppedAt = at;
    transitionTo(VmState.DOWN);
  }

  public synchronized void markAbandoned() {
    this.abandoned = true;
  }

  public synchronized boolean isAbandoned() {
    return abandoned;
  }

  public synchronized Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public synchronized Optional<Instant> getReadyAt() {
    return Optional.ofNullable(readyAt);
  }

  public synchronized Optional<Instant> getStoppedAt() {
    return Optional.ofNullable(stoppedAt);
  }

  public synchronized Duration getTotalIdle() {
    return totalIdle;
  }

  public synchronized Duration getLastIdle() {
    return lastIdle;
  }

  public synchronized void addIdle(Duration elapsed) {
    if (elapsed.isNegative()) {
      return;
    }
    totalIdle = totalIdle.plus(elapsed);
    lastIdle = lastIdle.plus(elapsed);
  }

  public synchronized void resetLastIdle() {
    lastIdle = Duration.ZERO;
  }

  public synchronized Set<String> getJobs() {
    return Set.copyOf(jobs);
  }

  public synchronized boolean hasJobs() {
    return !jobs.isEmpty();
  }

  public synchronized boolean assignJob(String jobId) {
    requireReady("assign job " + jobId);
    return jobs.add(jobId);
  }

  /**
   * Removes every assigned job that is not in {@code stillActive}.
   *
   * @return the job ids that were removed
   */
  public synchronized Set<String> retainJobs(Collection<String> stillActive) {
    requireReady("update jobs");
    Set<String> terminated = new LinkedHashSet<>(jobs);
    terminated.removeAll(stillActive);
    jobs.removeAll(terminated);
    return terminated;
  }

  public synchronized Optional<String> getNodeName() {
    return Optional.ofNullable(nodeName);
  }

  public synchronized void attachCloudInstance(String cloudId, String publicIp, String privateIp) {
    this.cloudId = cloudId;
    this.publicIp = publicIp;
    this.privateIp = privateIp;
  }

  public synchronized Optional<String> getCloudId() {
    return Optional.ofNullable(cloudId);
  }

  public synchronized Optional<String> getPublicIp() {
    return Optional.ofNullable(publicIp);
  }

  public synchronized Optional<String> getPrivateIp() {
    return Optional.ofNullable(privateIp);
  }

  public synchronized double getBill() {
    return bill;
  }

  public synchronized void addBill(double amount) {
    this.bill += amount;
  }

  /**
   * Time between the VM becoming usable (or, failing that, being started) and {@code end}.
   */
  public synchronized Duration runningTime(Instant end) {
    Instant from = readyAt != null ? readyAt : startedAt;
    if (from == null || end == null || end.isBefore(from)) {
      return Duration.ZERO;
    }
    return Duration.between(from, end);
  }

  private void requireReady(String action) {
    if (state != VmState.READY) {
      throw new IllegalStateException("Cannot " + action + " on " + this + " in state " + state);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof VmInfo other && vmId.equals(other.vmId);
  }

  @Override
  public int hashCode() {
    return vmId.hashCode();
  }

  @Override
  public synchronized String toString() {
    if (nodeName != null) {
      return "VM Node '" + nodeName + "'";
    }
    return "VM " + vmId;
  }
}
