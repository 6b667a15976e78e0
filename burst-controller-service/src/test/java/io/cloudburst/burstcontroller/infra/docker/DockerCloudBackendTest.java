package io.cloudburst.burstcontroller.infra.docker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.cloudburst.burst.model.VmInfo;
import io.cloudburst.burst.model.VmState;
import io.cloudburst.burstcontroller.config.BurstControllerProperties;
import io.cloudburst.docker.ContainerStatus;
import io.cloudburst.docker.DockerContainerClient;
import io.cloudburst.docker.DockerDaemonUnavailableException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DockerCloudBackendTest {

    @Mock
    private DockerContainerClient containers;

    private DockerCloudBackend backend;

    @BeforeEach
    void setUp() {
        BurstControllerProperties.Docker docker = new BurstControllerProperties.Docker(
            "cloudburst/node:1", "vm-", "http://controller:8080/api/vms/ready", "burst-net");
        backend = new DockerCloudBackend(containers, docker);
    }

    @Test
    void startHandsTokenToNamedContainer() {
        VmInfo vm = new VmInfo("7", "secret-token");
        when(containers.createAndStartContainer(eq("cloudburst/node:1"), anyMap(),
            eq("vm-7"), eq("burst-net"))).thenReturn("c-7");
        when(containers.inspectContainer("c-7"))
            .thenReturn(Optional.of(new ContainerStatus("c-7", "running", true, null, "172.20.0.9")));

        backend.start(vm);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> env = ArgumentCaptor.forClass(Map.class);
        verify(containers).createAndStartContainer(eq("cloudburst/node:1"), env.capture(), eq("vm-7"), eq("burst-net"));
        assertThat(env.getValue())
            .containsEntry("CLOUDBURST_VM_ID", "7")
            .containsEntry("CLOUDBURST_AUTH_TOKEN", "secret-token")
            .containsEntry("CLOUDBURST_READY_URL", "http://controller:8080/api/vms/ready");
        assertThat(vm.getCloudId()).contains("c-7");
        assertThat(vm.getPrivateIp()).contains("172.20.0.9");
    }

    @Test
    void stopFallsBackToContainerNameWithoutCloudId() {
        backend.stop(new VmInfo("9", "t"));

        verify(containers).stopAndRemoveContainer("vm-9");
    }

    @Test
    void refreshMovesRunningContainerUpAndExitedContainerToOther() {
        VmInfo booting = new VmInfo("1", "t1");
        VmInfo crashed = new VmInfo("2", "t2");
        VmInfo unknown = new VmInfo("3", "t3");
        VmInfo ready = new VmInfo("4", "t4");
        ready.markReady("node4", Instant.EPOCH);
        when(containers.inspectContainer("vm-1"))
            .thenReturn(Optional.of(new ContainerStatus("c-1", "running", true, null, "172.20.0.2")));
        when(containers.inspectContainer("vm-2"))
            .thenReturn(Optional.of(new ContainerStatus("c-2", "exited", false, 1L, null)));
        when(containers.inspectContainer("vm-3")).thenReturn(Optional.empty());
        when(containers.inspectContainer("vm-4"))
            .thenReturn(Optional.of(new ContainerStatus("c-4", "exited", false, 0L, null)));

        backend.refreshStatus(List.of(booting, crashed, unknown, ready));

        assertThat(booting.getState()).isEqualTo(VmState.UP);
        assertThat(booting.getPrivateIp()).contains("172.20.0.2");
        assertThat(crashed.getState()).isEqualTo(VmState.OTHER);
        assertThat(unknown.getState()).isEqualTo(VmState.STARTING);
        assertThat(ready.getState()).isEqualTo(VmState.READY);
    }

    @Test
    void refreshKeepsGoingAfterSingleInspectFailure() {
        VmInfo first = new VmInfo("1", "t1");
        VmInfo second = new VmInfo("2", "t2");
        when(containers.inspectContainer("vm-1")).thenThrow(new IllegalStateException("boom"));
        when(containers.inspectContainer("vm-2"))
            .thenReturn(Optional.of(new ContainerStatus("c-2", "running", true, null, null)));

        backend.refreshStatus(List.of(first, second));

        assertThat(first.getState()).isEqualTo(VmState.STARTING);
        assertThat(second.getState()).isEqualTo(VmState.UP);
    }

    @Test
    void refreshAbortsWhenDaemonIsUnavailable() {
        when(containers.inspectContainer(anyString()))
            .thenThrow(new DockerDaemonUnavailableException("daemon down", null));

        assertThatThrownBy(() -> backend.refreshStatus(List.of(new VmInfo("1", "t1"))))
            .isInstanceOf(DockerDaemonUnavailableException.class);
    }
}
