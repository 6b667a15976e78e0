package io.cloudburst.burst.runtime;

import io.cloudburst.burst.model.VmInfo;
import io.cloudburst.burst.ports.CloudBackend;
import io.cloudburst.burst.ports.Ticker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs cloud start/stop calls on a bounded worker pool.
 * <p>
 * Workers never touch the orchestrator's indices. Each finished call is turned into a
 * {@link TaskOutcome} and queued; the main loop collects them with {@link #drain()}. Tasks
 * that outlive their deadline are cancelled by {@link #expireOverdue()}, which reports them
 * as {@link TaskOutcome.Status#TIMED_OUT}. Exactly one outcome is produced per task.
 */
public final class VmTaskRunner implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(VmTaskRunner.class);

  private final CloudBackend cloud;
  private final ExecutorService workers;
  private final Ticker ticker;
  private final Duration deadline;
  private final BlockingQueue<TaskOutcome> completions = new LinkedBlockingQueue<>();
  private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

  public VmTaskRunner(CloudBackend cloud, int threads, Duration deadline, Ticker ticker) {
    this(cloud, Executors.newFixedThreadPool(threads, new WorkerThreadFactory()), deadline, ticker);
  }

  public VmTaskRunner(CloudBackend cloud, ExecutorService workers, Duration deadline, Ticker ticker) {
    this.cloud = Objects.requireNonNull(cloud, "cloud");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.deadline = Objects.requireNonNull(deadline, "deadline");
    this.ticker = Objects.requireNonNull(ticker, "ticker");
  }

  public void submitStart(VmInfo vm) {
    submit(TaskKind.START, vm, 1);
  }

  public void submitStop(VmInfo vm, int attempt) {
    submit(TaskKind.STOP, vm, attempt);
  }

  /**
   * Removes and returns every outcome reported by the workers so far.
   */
  public List<TaskOutcome> drain() {
    List<TaskOutcome> outcomes = new ArrayList<>();
    completions.drainTo(outcomes);
    return outcomes;
  }

  /**
   * Cancels every task past its deadline and returns a timed-out outcome for each.
   */
  public List<TaskOutcome> expireOverdue() {
    if (deadline.isZero() || inFlight.isEmpty()) {
      return List.of();
    }
    long now = ticker.nanoTime();
    List<TaskOutcome> expired = new ArrayList<>();
    for (Map.Entry<String, InFlight> entry : inFlight.entrySet()) {
      InFlight task = entry.getValue();
      if (now - task.deadlineNanos < 0) {
        continue;
      }
      if (inFlight.remove(entry.getKey(), task)) {
        Future<?> future = task.future;
        if (future != null) {
          future.cancel(true);
        }
        log.warn("{} of VM {} exceeded its deadline of {}s; cancelled",
            task.kind, task.vm.getVmId(), deadline.toSeconds());
        expired.add(TaskOutcome.timedOut(task.kind, task.vm, task.attempt));
      }
    }
    return expired;
  }

  public int inFlightCount() {
    return inFlight.size();
  }

  @Override
  public void close() {
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("VM task workers did not terminate; {} task(s) abandoned", inFlight.size());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void submit(TaskKind kind, VmInfo vm, int attempt) {
    String key = kind + ":" + vm.getVmId();
    InFlight task = new InFlight(kind, vm, attempt, ticker.nanoTime() + deadline.toNanos());
    InFlight previous = inFlight.putIfAbsent(key, task);
    if (previous != null) {
      throw new IllegalStateException(kind + " of VM " + vm.getVmId() + " is already in flight");
    }
    try {
      task.future = workers.submit(() -> execute(key, task));
    } catch (RejectedExecutionException e) {
      inFlight.remove(key, task);
      completions.add(TaskOutcome.failed(kind, vm, e, attempt));
    }
  }

  private void execute(String key, InFlight task) {
    TaskOutcome outcome;
    try {
      if (task.kind == TaskKind.START) {
        log.info("Starting VM {} ...", task.vm.getVmId());
        cloud.start(task.vm);
      } else {
        log.info("Stopping VM {} (attempt {}) ...", task.vm.getVmId(), task.attempt);
        cloud.stop(task.vm);
      }
      outcome = TaskOutcome.succeeded(task.kind, task.vm, task.attempt);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      outcome = TaskOutcome.failed(task.kind, task.vm, e, task.attempt);
    } catch (Exception e) {
      outcome = TaskOutcome.failed(task.kind, task.vm, e, task.attempt);
    }
    if (inFlight.remove(key, task)) {
      completions.add(outcome);
    } else {
      log.debug("Discarding late {} result for VM {}: task already timed out",
          task.kind, task.vm.getVmId());
    }
  }

  private static final class InFlight {
    final TaskKind kind;
    final VmInfo vm;
    final int attempt;
    final long deadlineNanos;
    volatile Future<?> future;

    InFlight(TaskKind kind, VmInfo vm, int attempt, long deadlineNanos) {
      this.kind = kind;
      this.vm = vm;
      this.attempt = attempt;
      this.deadlineNanos = deadlineNanos;
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "burst-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
