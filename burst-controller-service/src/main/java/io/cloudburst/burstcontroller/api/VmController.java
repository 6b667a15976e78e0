package io.cloudburst.burstcontroller.api;

import io.cloudburst.burst.model.VmInfo;
import io.cloudburst.burst.runtime.Orchestrator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the VMs and candidate jobs the orchestrator currently tracks.
 */
@RestController
@RequestMapping("/api")
public class VmController {

    private final Orchestrator orchestrator;

    public VmController(Orchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    @GetMapping("/vms")
    public List<VmView> vms() {
        List<VmView> views = new ArrayList<>();
        orchestrator.startingVms().forEach(vm -> views.add(VmView.of(vm, "starting")));
        orchestrator.activeVms().forEach(vm -> views.add(VmView.of(vm, "active")));
        orchestrator.stoppingVms().forEach(vm -> views.add(VmView.of(vm, "stopping")));
        return views;
    }

    @GetMapping("/candidates")
    public List<String> candidates() {
        return orchestrator.candidates().keySet().stream().sorted().toList();
    }

    public record VmView(String vmId,
                         String phase,
                         String state,
                         String nodeName,
                         List<String> jobs,
                         long totalIdleSeconds,
                         long lastIdleSeconds,
                         Instant startedAt,
                         Instant readyAt,
                         String cloudId,
                         String privateIp,
                         boolean abandoned) {

        static VmView of(VmInfo vm, String phase) {
            return new VmView(
                vm.getVmId(),
                phase,
                vm.getState().name(),
                vm.getNodeName().orElse(null),
                vm.getJobs().stream().sorted().toList(),
                vm.getTotalIdle().toSeconds(),
                vm.getLastIdle().toSeconds(),
                vm.getStartedAt().orElse(null),
                vm.getReadyAt().orElse(null),
                vm.getCloudId().orElse(null),
                vm.getPrivateIp().orElse(null),
                vm.isAbandoned());
        }
    }
}
