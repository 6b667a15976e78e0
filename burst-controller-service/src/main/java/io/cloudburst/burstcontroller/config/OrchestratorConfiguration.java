package io.cloudburst.burstcontroller.config;

import io.cloudburst.burst.ports.BatchQueuePort;
import io.cloudburst.burst.ports.BurstPolicy;
import io.cloudburst.burst.ports.Clock;
import io.cloudburst.burst.ports.CloudBackend;
import io.cloudburst.burst.ports.CycleHook;
import io.cloudburst.burst.ports.MetricsPort;
import io.cloudburst.burst.ports.Ticker;
import io.cloudburst.burst.runtime.Orchestrator;
import io.cloudburst.burst.runtime.OrchestratorSettings;
import io.cloudburst.burstcontroller.OrchestratorLoop;
import io.cloudburst.burstcontroller.metrics.MicrometerMetricsPort;
import io.cloudburst.burstcontroller.policy.IdleThresholdPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OrchestratorConfiguration {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfiguration.class);

    @Bean
    public BurstPolicy burstPolicy(BurstControllerProperties properties) {
        BurstControllerProperties.Policy policy = properties.getPolicy();
        return new IdleThresholdPolicy(policy.getIdleTimeout(), policy.getQueues());
    }

    @Bean
    public MetricsPort orchestratorMetrics(MeterRegistry meterRegistry) {
        return new MicrometerMetricsPort(meterRegistry);
    }

    @Bean
    public Orchestrator orchestrator(BatchQueuePort batchQueue,
                                     CloudBackend cloudBackend,
                                     BurstPolicy burstPolicy,
                                     MetricsPort orchestratorMetrics,
                                     BurstControllerProperties properties) {
        OrchestratorSettings settings = properties.getOrchestrator().toSettings();
        log.info("Orchestrator settings: {}", settings);
        return new Orchestrator(batchQueue, cloudBackend, burstPolicy, settings,
            Clock.system(), Ticker.system(), orchestratorMetrics, CycleHook.NONE, null);
    }

    @Bean
    public OrchestratorLoop orchestratorLoop(Orchestrator orchestrator, BurstControllerProperties properties) {
        BurstControllerProperties.Orchestrator loop = properties.getOrchestrator();
        return new OrchestratorLoop(orchestrator, loop.getCycleDelay(), loop.getMaxCycles());
    }
}
