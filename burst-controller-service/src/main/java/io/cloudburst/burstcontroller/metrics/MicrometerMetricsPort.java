package io.cloudburst.burstcontroller.metrics;

import io.cloudburst.burst.ports.MetricsPort;
import io.cloudburst.burst.runtime.OrchestratorMetrics;
import io.cloudburst.burst.runtime.TaskKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes orchestrator snapshots as Micrometer gauges and counters.
 * <p>
 * The orchestrator reports cumulative totals; counters are advanced by the difference to the
 * previous snapshot.
 */
public final class MicrometerMetricsPort implements MetricsPort {

    private final MeterRegistry meterRegistry;

    private final AtomicLong pendingAuth = new AtomicLong();
    private final AtomicLong active = new AtomicLong();
    private final AtomicLong ready = new AtomicLong();
    private final AtomicLong stopping = new AtomicLong();
    private final AtomicLong candidates = new AtomicLong();

    private final Counter starts;
    private final Counter stops;
    private final Counter startFailures;
    private final Counter stopFailures;
    private final Counter taskTimeouts;

    private OrchestratorMetrics previous = OrchestratorMetrics.empty();

    public MicrometerMetricsPort(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        gauge("cloudburst_vms_pending_auth", pendingAuth, "VMs started but not yet authenticated");
        gauge("cloudburst_vms_active", active, "VMs started and not being stopped");
        gauge("cloudburst_vms_ready", ready, "VMs that completed the readiness handshake");
        gauge("cloudburst_vms_stopping", stopping, "VMs waiting for their stop to complete");
        gauge("cloudburst_candidates", candidates, "Pending jobs eligible for cloud execution");
        this.starts = counter("cloudburst_vm_starts_total", "VM starts requested");
        this.stops = counter("cloudburst_vm_stops_total", "VMs stopped");
        this.startFailures = counter("cloudburst_vm_start_failures_total", "VM starts that failed");
        this.stopFailures = counter("cloudburst_vm_stop_failures_total", "VM stop attempts that failed");
        this.taskTimeouts = counter("cloudburst_vm_task_timeouts_total", "Start or stop calls cancelled at their deadline");
    }

    @Override
    public synchronized void update(OrchestratorMetrics snapshot) {
        pendingAuth.set(snapshot.pendingAuth());
        active.set(snapshot.active());
        ready.set(snapshot.ready());
        stopping.set(snapshot.stopping());
        candidates.set(snapshot.candidates());
        advance(starts, snapshot.startsRequested(), previous.startsRequested());
        advance(stops, snapshot.vmsStopped(), previous.vmsStopped());
        advance(startFailures, snapshot.startFailures(), previous.startFailures());
        advance(stopFailures, snapshot.stopFailures(), previous.stopFailures());
        advance(taskTimeouts, snapshot.taskTimeouts(), previous.taskTimeouts());
        previous = snapshot;
    }

    @Override
    public void taskEscalated(TaskKind kind, String vmId) {
        Counter.builder("cloudburst_vm_escalations_total")
            .description("Start or stop operations given up on after retries")
            .tag("kind", kind.name().toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment();
    }

    private void gauge(String name, AtomicLong value, String description) {
        Gauge.builder(name, value, AtomicLong::doubleValue)
            .description(description)
            .register(meterRegistry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .description(description)
            .register(meterRegistry);
    }

    private static void advance(Counter counter, long current, long before) {
        if (current > before) {
            counter.increment(current - before);
        }
    }
}
