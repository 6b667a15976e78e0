package io.cloudburst.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.RemoveContainerCmd;
import com.github.dockerjava.api.command.StartContainerCmd;
import com.github.dockerjava.api.command.StopContainerCmd;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.NetworkSettings;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class DockerContainerClientTest {

    private final DockerClient docker = mock(DockerClient.class);

    @Test
    void createsNamedContainerOnConfiguredNetwork() {
        CreateContainerCmd create = stubCreate();
        StartContainerCmd start = mock(StartContainerCmd.class);
        when(docker.startContainerCmd("cid")).thenReturn(start);

        DockerContainerClient client = new DockerContainerClient(docker);
        String id = client.createAndStartContainer("img", Map.of("CLOUDBURST_VM_ID", "7"), "burst-vm-7", "net1");

        assertThat(id).isEqualTo("cid");
        ArgumentCaptor<HostConfig> hostCaptor = ArgumentCaptor.forClass(HostConfig.class);
        verify(create).withHostConfig(hostCaptor.capture());
        assertThat(hostCaptor.getValue().getNetworkMode()).isEqualTo("net1");
        verify(create).withName("burst-vm-7");
        verify(create).withEnv(new String[] {"CLOUDBURST_VM_ID=7"});
        verify(start).exec();
    }

    @Test
    void wrapsMissingDockerSocketWithHelpfulMessage() {
        CreateContainerCmd create = stubCreate();
        when(create.exec()).thenThrow(new RuntimeException(new IOException("No such file or directory")));

        DockerContainerClient client = new DockerContainerClient(docker);

        assertThatThrownBy(() -> client.createContainer("img", Map.of(), "burst-vm-1", "net1"))
            .isInstanceOf(DockerDaemonUnavailableException.class)
            .hasMessageContaining("Docker daemon is unavailable");
    }

    @Test
    void wrapsConnectionRefusedOnStart() {
        StartContainerCmd start = mock(StartContainerCmd.class);
        when(docker.startContainerCmd("cid")).thenReturn(start);
        doThrow(new RuntimeException(new ConnectException("Connection refused"))).when(start).exec();

        DockerContainerClient client = new DockerContainerClient(docker);

        assertThatThrownBy(() -> client.startContainer("cid"))
            .isInstanceOf(DockerDaemonUnavailableException.class)
            .hasMessageContaining("Unable to start container");
    }

    @Test
    void otherDockerErrorsPassThrough() {
        StartContainerCmd start = mock(StartContainerCmd.class);
        when(docker.startContainerCmd("cid")).thenReturn(start);
        doThrow(new IllegalStateException("image has no entrypoint")).when(start).exec();

        DockerContainerClient client = new DockerContainerClient(docker);

        assertThatThrownBy(() -> client.startContainer("cid"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("image has no entrypoint");
    }

    @Test
    void inspectReportsRunningStateAndAddress() {
        InspectContainerCmd inspect = mock(InspectContainerCmd.class);
        InspectContainerResponse response = mock(InspectContainerResponse.class);
        InspectContainerResponse.ContainerState state = mock(InspectContainerResponse.ContainerState.class);
        NetworkSettings settings = mock(NetworkSettings.class);
        ContainerNetwork network = mock(ContainerNetwork.class);
        when(docker.inspectContainerCmd("cid")).thenReturn(inspect);
        when(inspect.exec()).thenReturn(response);
        when(response.getId()).thenReturn("cid");
        when(response.getState()).thenReturn(state);
        when(state.getRunning()).thenReturn(true);
        when(state.getStatus()).thenReturn("running");
        when(response.getNetworkSettings()).thenReturn(settings);
        when(settings.getNetworks()).thenReturn(Map.of("net1", network));
        when(network.getIpAddress()).thenReturn("172.18.0.5");

        ContainerStatus status = new DockerContainerClient(docker).inspectContainer("cid").orElseThrow();

        assertThat(status.running()).isTrue();
        assertThat(status.exited()).isFalse();
        assertThat(status.exitCode()).isNull();
        assertThat(status.ipAddress()).isEqualTo("172.18.0.5");
    }

    @Test
    void inspectOfUnknownContainerIsEmpty() {
        InspectContainerCmd inspect = mock(InspectContainerCmd.class);
        when(docker.inspectContainerCmd("gone")).thenReturn(inspect);
        when(inspect.exec()).thenThrow(new NotFoundException("No such container: gone"));

        assertThat(new DockerContainerClient(docker).inspectContainer("gone")).isEmpty();
    }

    @Test
    void stopTreatsAlreadyStoppedContainerAsStopped() {
        StopContainerCmd stop = mock(StopContainerCmd.class);
        RemoveContainerCmd remove = mock(RemoveContainerCmd.class);
        when(docker.stopContainerCmd("cid")).thenReturn(stop);
        when(docker.removeContainerCmd("cid")).thenReturn(remove);
        when(stop.exec()).thenThrow(new NotModifiedException("container already stopped"));

        new DockerContainerClient(docker).stopAndRemoveContainer("cid");

        verify(remove).exec();
    }

    @Test
    void stopOfMissingContainerSkipsRemoval() {
        StopContainerCmd stop = mock(StopContainerCmd.class);
        when(docker.stopContainerCmd("cid")).thenReturn(stop);
        when(stop.exec()).thenThrow(new NotFoundException("No such container: cid"));

        new DockerContainerClient(docker).stopAndRemoveContainer("cid");

        verify(docker, never()).removeContainerCmd(anyString());
    }

    private CreateContainerCmd stubCreate() {
        CreateContainerCmd create = mock(CreateContainerCmd.class);
        CreateContainerResponse resp = new CreateContainerResponse();
        resp.setId("cid");
        when(docker.createContainerCmd("img")).thenReturn(create);
        when(create.withHostConfig(any())).thenReturn(create);
        when(create.withEnv(any(String[].class))).thenReturn(create);
        when(create.withName(anyString())).thenReturn(create);
        when(create.exec()).thenReturn(resp);
        return create;
    }
}
