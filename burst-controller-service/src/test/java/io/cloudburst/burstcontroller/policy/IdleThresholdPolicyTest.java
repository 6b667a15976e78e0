package io.cloudburst.burstcontroller.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.cloudburst.burst.model.JobInfo;
import io.cloudburst.burst.model.JobState;
import io.cloudburst.burst.model.VmInfo;
import io.cloudburst.burst.ports.OrchestratorView;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class IdleThresholdPolicyTest {

    private final OrchestratorView view = mock(OrchestratorView.class);

    @Test
    void everyPendingJobIsCandidateWithoutQueueFilter() {
        IdleThresholdPolicy policy = new IdleThresholdPolicy(Duration.ofMinutes(5), List.of());

        assertThat(policy.isCloudCandidate(JobInfo.pending("1", Instant.EPOCH))).isTrue();
        assertThat(policy.isCloudCandidate(JobInfo.running("2", "node1", Instant.EPOCH))).isFalse();
    }

    @Test
    void queueFilterRestrictsCandidates() {
        IdleThresholdPolicy policy = new IdleThresholdPolicy(Duration.ofMinutes(5), List.of("cloud"));

        assertThat(policy.isCloudCandidate(new JobInfo("1", JobState.PENDING, null, null, null, "cloud"))).isTrue();
        assertThat(policy.isCloudCandidate(new JobInfo("2", JobState.PENDING, null, null, null, "local"))).isFalse();
        assertThat(policy.isCloudCandidate(JobInfo.pending("3", Instant.EPOCH))).isFalse();
    }

    @Test
    void stopsIdleVmOnceThresholdReached() {
        IdleThresholdPolicy policy = new IdleThresholdPolicy(Duration.ofMinutes(5), List.of());
        VmInfo vm = new VmInfo("1", "t");
        vm.markReady("node1", Instant.EPOCH);

        vm.addIdle(Duration.ofMinutes(4));
        assertThat(policy.canVmBeStopped(vm, view)).isFalse();

        vm.addIdle(Duration.ofMinutes(1));
        assertThat(policy.canVmBeStopped(vm, view)).isTrue();
    }

    @Test
    void busyVmIsNeverStopped() {
        IdleThresholdPolicy policy = new IdleThresholdPolicy(Duration.ZERO, List.of());
        VmInfo vm = new VmInfo("1", "t");
        vm.markReady("node1", Instant.EPOCH);
        vm.assignJob("J1");

        assertThat(policy.canVmBeStopped(vm, view)).isFalse();
    }
}
