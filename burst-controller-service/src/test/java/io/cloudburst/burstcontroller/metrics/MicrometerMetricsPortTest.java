package io.cloudburst.burstcontroller.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import io.cloudburst.burst.runtime.OrchestratorMetrics;
import io.cloudburst.burst.runtime.TaskKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MicrometerMetricsPortTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerMetricsPort metrics = new MicrometerMetricsPort(registry);

    @Test
    void gaugesFollowLatestSnapshot() {
        metrics.update(new OrchestratorMetrics(3, 5, 1, 1, 2, 1, 1, 4, 1, 0, 0, 0, 0, 0));

        assertThat(registry.get("cloudburst_vms_pending_auth").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("cloudburst_vms_active").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("cloudburst_vms_ready").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("cloudburst_vms_stopping").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("cloudburst_candidates").gauge().value()).isEqualTo(5.0);
    }

    @Test
    void countersAdvanceByDifferenceBetweenSnapshots() {
        metrics.update(new OrchestratorMetrics(1, 0, 0, 0, 0, 0, 0, 2, 0, 0, 1, 0, 0, 0));
        metrics.update(new OrchestratorMetrics(2, 0, 0, 0, 0, 0, 0, 5, 1, 1, 1, 2, 1, 0));

        assertThat(registry.get("cloudburst_vm_starts_total").counter().count()).isEqualTo(5.0);
        assertThat(registry.get("cloudburst_vm_stops_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("cloudburst_vm_start_failures_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("cloudburst_vm_stop_failures_total").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("cloudburst_vm_task_timeouts_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void escalationsAreCountedPerKind() {
        metrics.taskEscalated(TaskKind.STOP, "7");
        metrics.taskEscalated(TaskKind.STOP, "8");

        assertThat(registry.get("cloudburst_vm_escalations_total").tag("kind", "stop").counter().count())
            .isEqualTo(2.0);
    }
}
