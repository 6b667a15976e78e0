package io.cloudburst.burst.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class VmInfoTest {

  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void newVmIsStartingWithToken() {
    VmInfo vm = new VmInfo("1", "secret");

    assertThat(vm.getState()).isEqualTo(VmState.STARTING);
    assertThat(vm.getAuthToken()).contains("secret");
    assertThat(vm.getNodeName()).isEmpty();
    assertThat(vm).hasToString("VM 1");
  }

  @Test
  void markReadyConsumesTokenAndNamesNode() {
    VmInfo vm = new VmInfo("1", "secret");

    vm.markReady("node1", T0);

    assertThat(vm.getState()).isEqualTo(VmState.READY);
    assertThat(vm.getAuthToken()).isEmpty();
    assertThat(vm.getReadyAt()).contains(T0);
    assertThat(vm).hasToString("VM Node 'node1'");
  }

  @Test
  void illegalTransitionsAreRejected() {
    VmInfo vm = new VmInfo("1", "secret");
    vm.markReady("node1", T0);

    assertThatThrownBy(() -> vm.transitionTo(VmState.UP))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("READY to UP");
    assertThat(vm.transitionIfIn(VmState.STARTING, VmState.UP)).isFalse();
    assertThat(vm.getState()).isEqualTo(VmState.READY);
  }

  @Test
  void downIsTerminal() {
    for (VmState next : VmState.values()) {
      assertThat(VmState.DOWN.canTransitionTo(next)).as("DOWN -> %s", next).isFalse();
    }
    assertThat(VmState.STOPPING.canTransitionTo(VmState.DOWN)).isTrue();
    assertThat(VmState.READY.canTransitionTo(VmState.OTHER)).isTrue();
    assertThat(VmState.UP.isAlive()).isTrue();
    assertThat(VmState.READY.isAlive()).isFalse();
  }

  @Test
  void jobsCanOnlyBeTrackedWhileReady() {
    VmInfo vm = new VmInfo("1", "secret");

    assertThatThrownBy(() -> vm.assignJob("J1")).isInstanceOf(IllegalStateException.class);

    vm.markReady("node1", T0);
    vm.assignJob("J1");
    vm.assignJob("J2");

    assertThat(vm.retainJobs(List.of("J2"))).containsExactly("J1");
    assertThat(vm.getJobs()).containsExactly("J2");
  }

  @Test
  void idleTimeAccumulatesUntilReset() {
    VmInfo vm = new VmInfo("1", "secret");

    vm.addIdle(Duration.ofSeconds(30));
    vm.addIdle(Duration.ofSeconds(-5));
    vm.addIdle(Duration.ofSeconds(30));
    vm.resetLastIdle();
    vm.addIdle(Duration.ofSeconds(10));

    assertThat(vm.getTotalIdle()).isEqualTo(Duration.ofSeconds(70));
    assertThat(vm.getLastIdle()).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void runningTimeCountsFromReadinessWhenKnown() {
    VmInfo vm = new VmInfo("1", "secret");
    assertThat(vm.runningTime(T0)).isZero();

    vm.markStarted(T0);
    assertThat(vm.runningTime(T0.plusSeconds(100))).isEqualTo(Duration.ofSeconds(100));

    vm.markReady("node1", T0.plusSeconds(40));
    assertThat(vm.runningTime(T0.plusSeconds(100))).isEqualTo(Duration.ofSeconds(60));
  }

  @Test
  void equalityFollowsVmId() {
    assertThat(new VmInfo("7", "a")).isEqualTo(new VmInfo("7", "b"));
    assertThatThrownBy(() -> new VmInfo(" ", "a")).isInstanceOf(IllegalArgumentException.class);
  }
}
