package io.cloudburst.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.NetworkSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Container operations used to emulate cloud instances on a local Docker daemon.
 */
public class DockerContainerClient {
    private static final Logger log = LoggerFactory.getLogger(DockerContainerClient.class);
    private static final String DOCKER_HINT =
        "Ensure Docker is installed, running, and that the process can access the Docker socket "
            + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";

    private final DockerClient dockerClient;

    public DockerContainerClient(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    /**
     * Creates and starts a container.
     *
     * @param network network to attach to; {@code null} or blank uses {@link #resolveNetwork(String)}
     * @return the container id
     */
    public String createAndStartContainer(String image, Map<String, String> env, String containerName,
                                          String network) {
        String id = createContainer(image, env, containerName, network);
        startContainer(id);
        return id;
    }

    public String createContainer(String image, Map<String, String> env, String containerName, String network) {
        return callDocker("create container", () -> {
            CreateContainerCmd createCmd = dockerClient.createContainerCmd(image)
                .withHostConfig(HostConfig.newHostConfig().withNetworkMode(resolveNetwork(network)))
                .withEnv(toEnvArray(env));
            if (containerName != null && !containerName.isBlank()) {
                createCmd = createCmd.withName(containerName);
            }
            CreateContainerResponse response = createCmd.exec();
            log.debug("Created container {} ({}) from image {}", containerName, response.getId(), image);
            return response.getId();
        });
    }

    public void startContainer(String containerId) {
        callDocker("start container", () -> dockerClient.startContainerCmd(containerId).exec());
    }

    /**
     * Inspects a container.
     *
     * @return the container's status, or empty if Docker does not know the container
     */
    public Optional<ContainerStatus> inspectContainer(String containerId) {
        return callDocker("inspect container", () -> {
            InspectContainerResponse inspect;
            try {
                inspect = dockerClient.inspectContainerCmd(containerId).exec();
            } catch (NotFoundException e) {
                return Optional.<ContainerStatus>empty();
            }
            InspectContainerResponse.ContainerState state = inspect.getState();
            boolean running = state != null && Boolean.TRUE.equals(state.getRunning());
            String status = state == null ? null : state.getStatus();
            Long exitCode = state == null || running ? null : state.getExitCodeLong();
            return Optional.of(new ContainerStatus(inspect.getId(), status, running, exitCode,
                ipAddress(inspect.getNetworkSettings())));
        });
    }

    /**
     * Stops and removes a container. A container that is already stopped or gone counts as
     * stopped.
     */
    public void stopAndRemoveContainer(String containerId) {
        callDocker("stop container", () -> {
            try {
                dockerClient.stopContainerCmd(containerId).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} was already stopped", containerId);
            } catch (NotFoundException e) {
                log.debug("Container {} no longer exists", containerId);
                return;
            }
            dockerClient.removeContainerCmd(containerId).exec();
        });
    }

    /**
     * Returns {@code configured} when set, otherwise the first non-bridge network of the
     * container this process runs in, if any.
     */
    public String resolveNetwork(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String self = System.getenv("HOSTNAME");
        if (self == null) {
            return null;
        }
        try {
            InspectContainerResponse inspect = dockerClient.inspectContainerCmd(self).exec();
            return inspect.getNetworkSettings().getNetworks().keySet().stream()
                .filter(n -> !"bridge".equals(n))
                .findFirst().orElse(null);
        } catch (RuntimeException e) {
            log.debug("Not running inside a container ({}); using Docker's default network", e.toString());
            return null;
        }
    }

    private String ipAddress(NetworkSettings settings) {
        if (settings == null) {
            return null;
        }
        Map<String, ContainerNetwork> networks = settings.getNetworks();
        if (networks != null) {
            for (ContainerNetwork network : networks.values()) {
                String ip = network.getIpAddress();
                if (ip != null && !ip.isBlank()) {
                    return ip;
                }
            }
        }
        String ip = settings.getIpAddress();
        return ip == null || ip.isBlank() ? null : ip;
    }

    private String[] toEnvArray(Map<String, String> env) {
        return env.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .toArray(String[]::new);
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private void callDocker(String action, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof DockerDaemonUnavailableException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(
                "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT,
                e);
        }
        return e;
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if (messageContains(t, "Could not find a valid Docker environment")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
            .contains(needle.toLowerCase(Locale.ROOT));
    }
}
