package io.cloudburst.burstcontroller.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.cloudburst.burst.runtime.Orchestrator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoint booted VMs call to announce that they are ready to accept jobs.
 */
@RestController
@RequestMapping("/api/vms")
public class ReadinessController {
    private static final Logger log = LoggerFactory.getLogger(ReadinessController.class);

    private final Orchestrator orchestrator;

    public ReadinessController(Orchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    @PostMapping("/ready")
    public ResponseEntity<ReadinessResponse> ready(@RequestBody ReadinessRequest request) {
        if (isBlank(request.auth()) || isBlank(request.nodeName())) {
            log.warn("REST POST /api/vms/ready rejected: auth and nodename are required");
            return ResponseEntity.badRequest().body(new ReadinessResponse(false));
        }
        boolean accepted = orchestrator.vmIsReady(request.auth(), request.nodeName());
        log.debug("REST POST /api/vms/ready node={} accepted={}", request.nodeName(), accepted);
        if (!accepted) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(new ReadinessResponse(false));
        }
        return ResponseEntity.ok(new ReadinessResponse(true));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record ReadinessRequest(@JsonProperty("auth") String auth,
                                   @JsonProperty("nodename") String nodeName) {
    }

    public record ReadinessResponse(boolean accepted) {
    }
}
