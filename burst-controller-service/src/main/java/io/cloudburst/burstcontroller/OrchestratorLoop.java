package io.cloudburst.burstcontroller;

import io.cloudburst.burst.runtime.Orchestrator;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the orchestrator main loop on a dedicated thread for as long as the application
 * context is running.
 */
public final class OrchestratorLoop implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorLoop.class);
    private static final long JOIN_TIMEOUT_MS = 10_000L;

    private final Orchestrator orchestrator;
    private final Duration cycleDelay;
    private final long maxCycles;
    private volatile Thread thread;

    public OrchestratorLoop(Orchestrator orchestrator, Duration cycleDelay, long maxCycles) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.cycleDelay = Objects.requireNonNull(cycleDelay, "cycleDelay");
        this.maxCycles = maxCycles;
    }

    @Override
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        Thread loop = new Thread(this::runLoop, "burst-orchestrator");
        loop.setDaemon(true);
        thread = loop;
        loop.start();
        log.info("Orchestrator loop started (delay={}s, maxCycles={})", cycleDelay.toSeconds(),
            maxCycles == 0 ? "unbounded" : maxCycles);
    }

    @Override
    public synchronized void stop() {
        Thread loop = thread;
        if (loop == null) {
            return;
        }
        orchestrator.stop();
        loop.interrupt();
        try {
            loop.join(JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (loop.isAlive()) {
            log.warn("Orchestrator loop did not stop within {} ms", JOIN_TIMEOUT_MS);
        }
        thread = null;
        log.info("Orchestrator loop stopped after {} cycle(s)", orchestrator.cycle());
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        Thread loop = thread;
        return loop != null && loop.isAlive();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    private void runLoop() {
        try {
            orchestrator.run(cycleDelay, maxCycles);
        } catch (RuntimeException e) {
            log.error("Orchestrator loop terminated unexpectedly", e);
        }
    }
}
