package io.cloudburst.burst.runtime;

import io.cloudburst.burst.model.JobInfo;
import io.cloudburst.burst.model.JobState;
import io.cloudburst.burst.model.VmInfo;
import io.cloudburst.burst.model.VmState;
import io.cloudburst.burst.ports.BatchQueuePort;
import io.cloudburst.burst.ports.BurstPolicy;
import io.cloudburst.burst.ports.Clock;
import io.cloudburst.burst.ports.CloudBackend;
import io.cloudburst.burst.ports.CycleHook;
import io.cloudburst.burst.ports.MetricsPort;
import io.cloudburst.burst.ports.OrchestratorView;
import io.cloudburst.burst.ports.Ticker;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monitors a batch queue and a pool of cloud VMs, starting VMs when queued work needs
 * capacity and stopping them when the {@link BurstPolicy} says they are no longer needed.
 * <p>
 * All decisions are taken by one main-loop thread ({@link #run(Duration, long)} or
 * {@link #runCycle()}). Start and stop calls run on a {@link VmTaskRunner}; their outcomes
 * are applied by the main loop at the beginning of the next cycle. The readiness handshake
 * ({@link #vmIsReady(String, String)}) may be called from any thread.
 */
public final class Orchestrator implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

  private final BatchQueuePort batch;
  private final CloudBackend cloud;
  private final BurstPolicy policy;
  private final OrchestratorSettings settings;
  private final Clock clock;
  private final Ticker ticker;
  private final MetricsPort metrics;
  private final CycleHook hook;
  private final VmTaskRunner tasks;
  private final ExecutorService statusRefresher;
  private final VmIndex index = new VmIndex();
  private final AuthTokenGenerator tokens = new AuthTokenGenerator();
  private final OrchestratorView view = new View();

  private final Map<String, JobInfo> candidates = new ConcurrentHashMap<>();
  private Map<String, JobState> lastJobStates = Map.of();
  private final Set<String> issuedVmIds = new HashSet<>();
  private final Map<String, Long> readyDeadlines = new HashMap<>();
  private long vmSequence;
  private Long lastCycleStartNanos;
  private Future<?> pendingRefresh;

  private volatile Instant lastUpdate = Instant.EPOCH;
  private volatile long cycle;
  private volatile boolean running;
  private volatile OrchestratorMetrics metricsSnapshot = OrchestratorMetrics.empty();

  private long startsRequested;
  private long stopsRequested;
  private long vmsStopped;
  private long startFailures;
  private long stopFailures;
  private long taskTimeouts;
  private long escalations;

  public Orchestrator(BatchQueuePort batch,
                      CloudBackend cloud,
                      BurstPolicy policy,
                      OrchestratorSettings settings) {
    this(batch, cloud, policy, settings, Clock.system(), Ticker.system(), MetricsPort.noop(),
        CycleHook.NONE, null);
  }

  /**
   * @param workers executor for start/stop calls; {@code null} creates a fixed pool of
   *                {@link OrchestratorSettings#workerThreads()} daemon threads
   */
  public Orchestrator(BatchQueuePort batch,
                      CloudBackend cloud,
                      BurstPolicy policy,
                      OrchestratorSettings settings,
                      Clock clock,
                      Ticker ticker,
                      MetricsPort metrics,
                      CycleHook hook,
                      ExecutorService workers) {
    this.batch = Objects.requireNonNull(batch, "batch");
    this.cloud = Objects.requireNonNull(cloud, "cloud");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ticker = Objects.requireNonNull(ticker, "ticker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.hook = Objects.requireNonNull(hook, "hook");
    this.tasks = workers == null
        ? new VmTaskRunner(cloud, settings.workerThreads(), settings.taskDeadline(), ticker)
        : new VmTaskRunner(cloud, workers, settings.taskDeadline(), ticker);
    this.statusRefresher = Executors.newSingleThreadExecutor(r -> {
      Thread thread = new Thread(r, "burst-status-refresh");
      thread.setDaemon(true);
      return thread;
    });
    if (settings.maxDelta() > 1) {
      log.info("maxDelta={} accepted; at most one VM is started per cycle", settings.maxDelta());
    }
  }

  /**
   * Runs the main loop until {@link #stop()} is called, the thread is interrupted, or
   * {@code maxCycles} cycles have run ({@code 0} means run forever).
   */
  public void run(Duration delay, long maxCycles) {
    Objects.requireNonNull(delay, "delay");
    running = true;
    long done = 0;
    while (running && (maxCycles == 0 || done < maxCycles)) {
      long t0 = ticker.nanoTime();
      runCycle();
      done++;
      if (delay.isZero() || delay.isNegative() || (maxCycles != 0 && done >= maxCycles)) {
        continue;
      }
      Duration elapsed = Duration.ofNanos(ticker.nanoTime() - t0);
      if (elapsed.compareTo(delay) > 0) {
        log.warn("Cycle {} took more than {} seconds! Starting new cycle without delay.",
            cycle, delay.toSeconds());
      } else {
        pause(delay.minus(elapsed));
      }
    }
    running = false;
  }

  public void stop() {
    running = false;
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Performs one orchestration cycle: apply finished tasks, update job status, refresh VM
   * status, account idle time, then scale up and scale down, in that order.
   */
  public void runCycle() {
    long cycleStart = ticker.nanoTime();
    Duration sinceLastCycle = lastCycleStartNanos == null
        ? Duration.ZERO
        : Duration.ofNanos(cycleStart - lastCycleStartNanos);
    log.debug("Orchestrator about to start cycle {}", cycle);
    try {
      tasks.drain().forEach(this::applyOutcomeSafely);
      tasks.expireOverdue().forEach(this::applyOutcomeSafely);
      hook.beforeCycle(cycle);
      try {
        updateJobStatus();
      } catch (Exception e) {
        log.error("Cycle {} aborted: unable to read batch queue status: {}", cycle, e.toString(), e);
        return;
      }
      refreshVmStatus();
      accountIdleTime(sinceLastCycle);
      // an aborted cycle leaves the mark in place, so its interval is counted next time
      lastCycleStartNanos = cycleStart;
      scaleUp();
      scaleDown();
      hook.afterCycle(cycle);
    } catch (RuntimeException e) {
      log.error("Cycle {} failed: {}", cycle, e.toString(), e);
    } finally {
      publishMetrics();
      cycle++;
    }
  }

  /**
   * Readiness handshake: a booted VM presents the token it was given at provisioning time
   * together with the node name it reports to the batch system.
   *
   * @return {@code true} if the token matched a VM waiting for it; {@code false} otherwise,
   *     with no state change
   */
  public boolean vmIsReady(String auth, String nodeName) {
    if (nodeName == null || nodeName.isBlank()) {
      log.error("Received READY notification without a node name. Ignoring.");
      return false;
    }
    VmIndex.Readiness readiness = index.acceptReadiness(auth, nodeName, clock.now());
    switch (readiness.outcome()) {
      case ACCEPTED -> {
        log.info("VM {} reports being ready as node '{}'", readiness.vm().getVmId(), nodeName);
        return true;
      }
      case UNKNOWN_TOKEN -> log.error(
          "Received notification that node '{}' is READY,"
              + " but authentication data does not match any started VM.  Ignoring.",
          nodeName);
      case NODE_NAME_IN_USE -> log.error(
          "Received notification that node '{}' is READY, but that node name already belongs to VM {}."
              + "  Ignoring.",
          nodeName, readiness.vm().getVmId());
      case NOT_BOOTING -> log.error(
          "Received notification that node '{}' is READY, but VM {} is in state {}.  Ignoring.",
          nodeName, readiness.vm().getVmId(), readiness.vm().getState());
    }
    return false;
  }

  public Map<String, JobInfo> candidates() {
    return Map.copyOf(candidates);
  }

  public List<VmInfo> activeVms() {
    return index.activeVms();
  }

  public List<VmInfo> startingVms() {
    return index.stagedVms();
  }

  public List<VmInfo> stoppingVms() {
    return index.stoppingVms();
  }

  public Optional<VmInfo> findByNode(String nodeName) {
    return index.findByNode(nodeName);
  }

  public int pendingAuthCount() {
    return index.pendingAuthCount();
  }

  public int inFlightTasks() {
    return tasks.inFlightCount();
  }

  public Instant lastUpdate() {
    return lastUpdate;
  }

  public long cycle() {
    return cycle;
  }

  public OrchestratorMetrics metrics() {
    return metricsSnapshot;
  }

  public OrchestratorSettings settings() {
    return settings;
  }

  @Override
  public void close() {
    running = false;
    tasks.close();
    statusRefresher.shutdownNow();
  }

  private void updateJobStatus() throws Exception {
    Instant now = clock.now();
    List<JobInfo> jobs = batch.snapshot();
    Map<String, JobInfo> byId = new LinkedHashMap<>();
    for (JobInfo job : jobs) {
      if (byId.put(job.jobId(), job) != null) {
        log.warn("Batch system reported job {} more than once; using the last entry", job.jobId());
      }
    }

    Set<String> stillActive = new HashSet<>();
    byId.values().stream()
        .filter(job -> job.state() != JobState.FINISHED)
        .forEach(job -> stillActive.add(job.jobId()));
    for (VmInfo vm : index.readyVms()) {
      String node = vm.getNodeName().orElse(vm.getVmId());
      for (String jobId : vm.retainJobs(stillActive)) {
        log.info("Job {} terminated its execution on node '{}'", jobId, node);
      }
    }

    Map<String, JobState> states = new HashMap<>();
    for (JobInfo job : byId.values()) {
      JobState previous = lastJobStates.get(job.jobId());
      states.put(job.jobId(), job.state());
      if (job.isRunning() && previous != JobState.RUNNING) {
        log.info("Job {} was started on node '{}'", job.jobId(), job.execNodeName());
        candidates.remove(job.jobId());
        index.findByNode(job.execNodeName()).ifPresent(vm -> vm.assignJob(job.jobId()));
      } else if (job.isPending() && previous != JobState.PENDING) {
        if (policy.isCloudCandidate(job)) {
          log.debug("Job {} is a candidate for cloud execution", job.jobId());
          candidates.put(job.jobId(), job);
        }
      }
    }

    candidates.keySet().removeIf(jobId -> {
      JobInfo current = byId.get(jobId);
      if (current == null) {
        log.info("Candidate job {} left the batch queue", jobId);
        return true;
      }
      return !current.isPending();
    });

    lastJobStates = states;
    lastUpdate = now;
  }

  private void refreshVmStatus() {
    List<VmInfo> vms = index.activeVms();
    if (vms.isEmpty()) {
      return;
    }
    if (pendingRefresh != null && !pendingRefresh.isDone()) {
      log.warn("Previous VM status refresh is still running; skipping refresh in cycle {}", cycle);
      return;
    }
    Future<?> refresh = statusRefresher.submit(() -> {
      cloud.refreshStatus(vms);
      return null;
    });
    pendingRefresh = refresh;
    Duration timeout = settings.statusRefreshTimeout();
    try {
      refresh.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      refresh.cancel(true);
      log.warn("VM status refresh did not complete within {} ms; continuing with stale status",
          timeout.toMillis());
    } catch (ExecutionException e) {
      log.warn("VM status refresh failed: {}", e.getCause().toString(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      refresh.cancel(true);
      running = false;
    }
  }

  private void accountIdleTime(Duration elapsed) {
    for (VmInfo vm : index.activeVms()) {
      if (!vm.hasJobs()) {
        vm.addIdle(elapsed);
      } else {
        vm.resetLastIdle();
      }
    }
  }

  private void scaleUp() {
    if (!policy.isNewVmNeeded(view)) {
      return;
    }
    int allocated = index.allocatedCount();
    if (allocated >= settings.maxVms()) {
      log.debug("New VM needed but {} of {} VMs are already allocated", allocated, settings.maxVms());
      return;
    }
    VmInfo vm = new VmInfo(nextVmId(), tokens.next());
    index.registerStarting(vm);
    startsRequested++;
    log.info("Requesting new VM {} ({} candidate job(s), {} of {} VMs allocated)",
        vm.getVmId(), candidates.size(), allocated + 1, settings.maxVms());
    tasks.submitStart(vm);
  }

  private void scaleDown() {
    for (VmInfo vm : index.activeVms()) {
      VmState state = vm.getState();
      if (state == VmState.OTHER) {
        log.error("VM {} is in unexpected state {}; stopping it", vm.getVmId(), state);
        requestStop(vm);
        continue;
      }
      if (state != VmState.READY) {
        stopIfReadyOverdue(vm);
        continue;
      }
      readyDeadlines.remove(vm.getVmId());
      if (!policy.canVmBeStopped(vm, view)) {
        continue;
      }
      if (vm.hasJobs()) {
        log.warn("Request to stop VM {}, but it's still running jobs: {}",
            vm.getVmId(), String.join(" ", vm.getJobs()));
      }
      requestStop(vm);
    }
  }

  private void stopIfReadyOverdue(VmInfo vm) {
    Long deadline = readyDeadlines.get(vm.getVmId());
    if (deadline == null || ticker.nanoTime() - deadline < 0) {
      return;
    }
    log.error("VM {} did not report ready within {}s of starting; stopping it",
        vm.getVmId(), settings.readyTimeout().toSeconds());
    requestStop(vm);
  }

  private void requestStop(VmInfo vm) {
    readyDeadlines.remove(vm.getVmId());
    if (index.moveToStopping(vm)) {
      stopsRequested++;
      tasks.submitStop(vm, 1);
    }
  }

  private void applyOutcomeSafely(TaskOutcome outcome) {
    try {
      applyOutcome(outcome);
    } catch (RuntimeException e) {
      log.error("Unable to apply {} outcome of VM {}: {}", outcome.kind(), outcome.vm().getVmId(),
          e.toString(), e);
    }
  }

  private void applyOutcome(TaskOutcome outcome) {
    if (outcome.kind() == TaskKind.START) {
      applyStartOutcome(outcome);
    } else {
      applyStopOutcome(outcome);
    }
  }

  private void applyStartOutcome(TaskOutcome outcome) {
    VmInfo vm = outcome.vm();
    if (outcome.isSuccess()) {
      vm.markStarted(clock.now());
      switch (index.confirmStarted(vm)) {
        case ACTIVATED -> {
          if (!settings.readyTimeout().isZero()) {
            readyDeadlines.put(vm.getVmId(), ticker.nanoTime() + settings.readyTimeout().toNanos());
          }
          log.info("VM {} started, waiting for 'READY' notification.", vm.getVmId());
        }
        case ALREADY_ACTIVE -> log.info("VM {} started; it already reported ready as node '{}'",
            vm.getVmId(), vm.getNodeName().orElse("?"));
        case NOT_STAGED -> log.warn("VM {} started but is no longer tracked as starting (state {})",
            vm.getVmId(), vm.getState());
      }
      return;
    }
    if (outcome.status() == TaskOutcome.Status.TIMED_OUT) {
      taskTimeouts++;
      if (vm.getState() == VmState.READY) {
        log.warn("Start of VM {} timed out but it already reported ready as node '{}'; keeping it",
            vm.getVmId(), vm.getNodeName().orElse("?"));
        return;
      }
      log.error("Starting VM {} did not complete in time; stopping whatever was created", vm.getVmId());
      requestStop(vm);
      return;
    }
    startFailures++;
    if (!index.discardStart(vm)) {
      log.warn("Start of VM {} reported '{}' but it is no longer starting (state {}, node '{}'); keeping it",
          vm.getVmId(), outcome.describeError(), vm.getState(), vm.getNodeName().orElse("?"));
      return;
    }
    vm.transitionTo(VmState.DOWN);
    log.error("Error starting VM {}: {}", vm.getVmId(), outcome.describeError(), outcome.error());
  }

  private void applyStopOutcome(TaskOutcome outcome) {
    VmInfo vm = outcome.vm();
    if (outcome.isSuccess()) {
      Instant now = clock.now();
      vm.markStopped(now);
      index.completeStop(vm);
      vmsStopped++;
      Duration ran = vm.runningTime(now);
      Duration idle = vm.getTotalIdle();
      double idlePct = ran.isZero() ? 0.0 : 100.0 * idle.toMillis() / ran.toMillis();
      log.info("Stopped VM {} ({}); it has run for {} seconds, been idle for {} of them ({}%)",
          vm.getVmId(), vm.getNodeName().orElse("never ready"), ran.toSeconds(), idle.toSeconds(),
          String.format("%.2f", idlePct));
      return;
    }
    if (outcome.status() == TaskOutcome.Status.TIMED_OUT) {
      taskTimeouts++;
    } else {
      stopFailures++;
    }
    if (outcome.attempt() <= settings.stopRetries()) {
      log.warn("Error stopping VM {} (attempt {}): {}; retrying",
          vm.getVmId(), outcome.attempt(), outcome.describeError(), outcome.error());
      tasks.submitStop(vm, outcome.attempt() + 1);
      return;
    }
    vm.markAbandoned();
    escalations++;
    log.error("ALERT: giving up on stopping VM {} ({}) after {} attempt(s), last error {};"
            + " it stays in the stopping set and may still be billed by the cloud provider",
        vm.getVmId(), vm.getNodeName().orElse("never ready"), outcome.attempt(),
        outcome.describeError(), outcome.error());
    metrics.taskEscalated(TaskKind.STOP, vm.getVmId());
  }

  private String nextVmId() {
    String vmId = Long.toString(++vmSequence);
    if (!issuedVmIds.add(vmId)) {
      throw new IllegalStateException("VM id " + vmId + " has already been issued");
    }
    return vmId;
  }

  private void publishMetrics() {
    OrchestratorMetrics snapshot = new OrchestratorMetrics(
        cycle,
        candidates.size(),
        index.pendingAuthCount(),
        index.stagedCount(),
        index.activeCount(),
        index.readyCount(),
        index.stoppingCount(),
        startsRequested,
        stopsRequested,
        vmsStopped,
        startFailures,
        stopFailures,
        taskTimeouts,
        escalations);
    metricsSnapshot = snapshot;
    try {
      metrics.update(snapshot);
    } catch (RuntimeException e) {
      log.warn("Unable to publish orchestrator metrics: {}", e.toString());
    }
  }

  private void pause(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running = false;
    }
  }

  private final class View implements OrchestratorView {

    @Override
    public Map<String, JobInfo> candidates() {
      return Map.copyOf(candidates);
    }

    @Override
    public Collection<VmInfo> activeVms() {
      return index.activeVms();
    }

    @Override
    public int maxVms() {
      return settings.maxVms();
    }
  }
}
