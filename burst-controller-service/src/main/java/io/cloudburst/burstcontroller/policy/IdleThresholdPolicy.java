package io.cloudburst.burstcontroller.policy;

import io.cloudburst.burst.model.JobInfo;
import io.cloudburst.burst.model.VmInfo;
import io.cloudburst.burst.ports.BurstPolicy;
import io.cloudburst.burst.ports.OrchestratorView;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Bursts every pending job of the configured queues and stops a VM once it has run no job
 * for {@code idleTimeout}.
 */
public class IdleThresholdPolicy implements BurstPolicy {

    private final Duration idleTimeout;
    private final Set<String> queues;

    /**
     * @param queues queues eligible for cloud execution; empty accepts every queue
     */
    public IdleThresholdPolicy(Duration idleTimeout, Collection<String> queues) {
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.queues = Set.copyOf(Objects.requireNonNull(queues, "queues"));
    }

    @Override
    public boolean isCloudCandidate(JobInfo job) {
        if (!job.isPending()) {
            return false;
        }
        return queues.isEmpty() || (job.queue() != null && queues.contains(job.queue()));
    }

    @Override
    public boolean canVmBeStopped(VmInfo vm, OrchestratorView view) {
        return !vm.hasJobs() && vm.getLastIdle().compareTo(idleTimeout) >= 0;
    }
}
