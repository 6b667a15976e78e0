package io.cloudburst.burstcontroller.infra.docker;

import io.cloudburst.burst.model.VmInfo;
import io.cloudburst.burst.model.VmState;
import io.cloudburst.burst.ports.CloudBackend;
import io.cloudburst.burstcontroller.config.BurstControllerProperties;
import io.cloudburst.docker.ContainerStatus;
import io.cloudburst.docker.DockerContainerClient;
import io.cloudburst.docker.DockerDaemonUnavailableException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs burst VMs as containers on the local Docker daemon.
 * <p>
 * Each VM becomes a container named {@code <name-prefix><vmId>} that receives its id, its
 * readiness token and the readiness URL through the environment.
 */
public class DockerCloudBackend implements CloudBackend {
    static final String ENV_VM_ID = "CLOUDBURST_VM_ID";
    static final String ENV_AUTH_TOKEN = "CLOUDBURST_AUTH_TOKEN";
    static final String ENV_READY_URL = "CLOUDBURST_READY_URL";

    private static final Logger log = LoggerFactory.getLogger(DockerCloudBackend.class);

    private final DockerContainerClient containers;
    private final BurstControllerProperties.Docker docker;

    public DockerCloudBackend(DockerContainerClient containers, BurstControllerProperties.Docker docker) {
        this.containers = Objects.requireNonNull(containers, "containers");
        this.docker = Objects.requireNonNull(docker, "docker");
    }

    @Override
    public void start(VmInfo vm) {
        String token = vm.getAuthToken()
            .orElseThrow(() -> new IllegalStateException(vm + " has no auth token to hand over"));
        Map<String, String> env = new LinkedHashMap<>();
        env.put(ENV_VM_ID, vm.getVmId());
        env.put(ENV_AUTH_TOKEN, token);
        env.put(ENV_READY_URL, docker.getReadyUrl());
        String name = containerName(vm);
        String containerId = containers.createAndStartContainer(docker.getImage(), env, name, docker.getNetwork());
        String ip = containers.inspectContainer(containerId).map(ContainerStatus::ipAddress).orElse(null);
        vm.attachCloudInstance(containerId, null, ip);
        log.info("Started container {} ({}) for VM {} at {}", name, containerId, vm.getVmId(), ip);
    }

    @Override
    public void stop(VmInfo vm) {
        String target = vm.getCloudId().orElse(containerName(vm));
        containers.stopAndRemoveContainer(target);
        log.info("Stopped and removed container {} of VM {}", target, vm.getVmId());
    }

    @Override
    public void refreshStatus(Collection<VmInfo> vms) {
        for (VmInfo vm : vms) {
            String target = vm.getCloudId().orElse(containerName(vm));
            Optional<ContainerStatus> status;
            try {
                status = containers.inspectContainer(target);
            } catch (DockerDaemonUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Unable to inspect container {} of VM {}: {}", target, vm.getVmId(), e.toString());
                continue;
            }
            status.ifPresentOrElse(
                s -> apply(vm, s),
                () -> log.debug("Container {} of VM {} is not known to Docker", target, vm.getVmId()));
        }
    }

    private void apply(VmInfo vm, ContainerStatus status) {
        if (vm.getPrivateIp().isEmpty() && status.ipAddress() != null) {
            vm.attachCloudInstance(vm.getCloudId().orElse(status.containerId()), null, status.ipAddress());
        }
        if (status.running()) {
            if (vm.transitionIfIn(VmState.STARTING, VmState.UP)) {
                log.info("VM {} is up", vm.getVmId());
            }
            return;
        }
        if (status.exited()) {
            VmState state = vm.getState();
            if (state.isAlive() && vm.transitionIfIn(state, VmState.OTHER)) {
                log.warn("Container of VM {} exited with code {} before reporting ready",
                    vm.getVmId(), status.exitCode());
            }
        }
    }

    String containerName(VmInfo vm) {
        return docker.getNamePrefix() + vm.getVmId();
    }
}
