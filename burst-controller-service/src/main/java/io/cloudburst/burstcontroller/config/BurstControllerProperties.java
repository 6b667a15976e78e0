package io.cloudburst.burstcontroller.config;

import io.cloudburst.burst.runtime.OrchestratorSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cloudburst.controller")
public class BurstControllerProperties {

    private final Orchestrator orchestrator;
    private final Policy policy;
    private final Batch batch;
    private final Docker docker;

    public BurstControllerProperties(@Valid Orchestrator orchestrator,
                                     @Valid Policy policy,
                                     @Valid Batch batch,
                                     @Valid Docker docker) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.batch = Objects.requireNonNull(batch, "batch");
        this.docker = Objects.requireNonNull(docker, "docker");
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public Policy getPolicy() {
        return policy;
    }

    public Batch getBatch() {
        return batch;
    }

    public Docker getDocker() {
        return docker;
    }

    /**
     * Main loop settings. Only {@code cycle-delay} and {@code max-vms} are required; the
     * rest fall back to {@link OrchestratorSettings#defaults(int)}.
     */
    @Validated
    public static final class Orchestrator {

        private final Duration cycleDelay;
        private final long maxCycles;
        private final OrchestratorSettings settings;

        public Orchestrator(@NotNull Duration cycleDelay,
                            @PositiveOrZero Long maxCycles,
                            @NotNull @PositiveOrZero Integer maxVms,
                            Integer maxDelta,
                            Integer workerThreads,
                            Duration taskDeadline,
                            Duration statusRefreshTimeout,
                            Duration readyTimeout,
                            Integer stopRetries) {
            this.cycleDelay = Objects.requireNonNull(cycleDelay, "cycleDelay");
            this.maxCycles = maxCycles == null ? 0L : maxCycles;
            OrchestratorSettings defaults = OrchestratorSettings.defaults(Objects.requireNonNull(maxVms, "maxVms"));
            this.settings = new OrchestratorSettings(
                maxVms,
                maxDelta == null ? defaults.maxDelta() : maxDelta,
                workerThreads == null ? defaults.workerThreads() : workerThreads,
                taskDeadline == null ? defaults.taskDeadline() : taskDeadline,
                statusRefreshTimeout == null ? defaults.statusRefreshTimeout() : statusRefreshTimeout,
                readyTimeout == null ? defaults.readyTimeout() : readyTimeout,
                stopRetries == null ? defaults.stopRetries() : stopRetries);
        }

        public Duration getCycleDelay() {
            return cycleDelay;
        }

        /**
         * Number of cycles to run before the loop ends; {@code 0} runs until shutdown.
         */
        public long getMaxCycles() {
            return maxCycles;
        }

        public OrchestratorSettings toSettings() {
            return settings;
        }
    }

    @Validated
    public static final class Policy {

        private final Duration idleTimeout;
        private final List<String> queues;

        public Policy(@NotNull Duration idleTimeout, List<String> queues) {
            this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
            if (idleTimeout.isNegative()) {
                throw new IllegalArgumentException("idleTimeout must not be negative");
            }
            this.queues = queues == null ? List.of() : List.copyOf(queues);
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        /**
         * Queues whose pending jobs may burst to the cloud; empty means every queue.
         */
        public List<String> getQueues() {
            return queues;
        }
    }

    @Validated
    public static final class Batch {

        private final String url;
        private final Duration connectTimeout;
        private final Duration readTimeout;

        public Batch(@NotBlank String url, Duration connectTimeout, Duration readTimeout) {
            this.url = requireNonBlank(url, "url");
            this.connectTimeout = connectTimeout;
            this.readTimeout = readTimeout;
        }

        public String getUrl() {
            return url;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }
    }

    @Validated
    public static final class Docker {

        private static final String DEFAULT_NAME_PREFIX = "burst-vm-";

        private final String image;
        private final String namePrefix;
        private final String readyUrl;
        private final String network;

        public Docker(@NotBlank String image, String namePrefix, @NotBlank String readyUrl, String network) {
            this.image = requireNonBlank(image, "image");
            this.namePrefix = namePrefix == null || namePrefix.isBlank() ? DEFAULT_NAME_PREFIX : namePrefix.trim();
            this.readyUrl = requireNonBlank(readyUrl, "readyUrl");
            this.network = network == null || network.isBlank() ? null : network.trim();
        }

        public String getImage() {
            return image;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        /**
         * URL a started VM posts its readiness notification to.
         */
        public String getReadyUrl() {
            return readyUrl;
        }

        public String getNetwork() {
            return network;
        }
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
