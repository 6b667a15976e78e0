package io.cloudburst.docker;

/**
 * What {@code docker inspect} reports about one container.
 *
 * @param status    Docker's status word ({@code created}, {@code running}, {@code exited}, ...)
 * @param exitCode  exit code, {@code null} while the container has not exited
 * @param ipAddress address on the container's network, {@code null} if it has none yet
 */
public record ContainerStatus(String containerId, String status, boolean running, Long exitCode, String ipAddress) {

    public boolean exited() {
        return "exited".equals(status) || "dead".equals(status);
    }
}
