package io.cloudburst.burstcontroller.infra.batch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudburst.burst.model.JobInfo;
import io.cloudburst.burst.model.JobState;
import io.cloudburst.burst.ports.BatchQueuePort;
import io.cloudburst.burstcontroller.config.BurstControllerProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the batch queue from an HTTP endpoint that lists every known job as a JSON array.
 */
@Component
public class HttpBatchQueueClient implements BatchQueuePort {
    private static final Logger log = LoggerFactory.getLogger(HttpBatchQueueClient.class);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final TypeReference<List<BatchJob>> JOB_LIST = new TypeReference<>() {
    };

    private final HttpClient http;
    private final ObjectMapper json;
    private final URI url;
    private final Duration requestTimeout;

    public HttpBatchQueueClient(ObjectMapper json, BurstControllerProperties properties) {
        this.json = Objects.requireNonNull(json, "json");
        BurstControllerProperties.Batch batch = properties.getBatch();
        this.http = HttpClient.newBuilder()
            .connectTimeout(resolveTimeout(batch.getConnectTimeout(), DEFAULT_CONNECT_TIMEOUT))
            .build();
        this.url = URI.create(batch.getUrl());
        this.requestTimeout = resolveTimeout(batch.getReadTimeout(), DEFAULT_REQUEST_TIMEOUT);
    }

    @Override
    public List<JobInfo> snapshot() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
            .uri(url)
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        log.debug("batch queue response status {} length {}", resp.statusCode(),
            resp.body() != null ? resp.body().length() : 0);
        if (resp.statusCode() != 200) {
            throw new IllegalStateException("batch queue fetch from " + url + " status " + resp.statusCode());
        }
        return parse(resp.body());
    }

    /**
     * Converts a job listing into job records. Entries that break the job contract are
     * skipped with a warning so that one bad line cannot stall the orchestrator.
     */
    List<JobInfo> parse(String body) throws IOException {
        List<BatchJob> entries = json.readValue(body, JOB_LIST);
        List<JobInfo> jobs = new ArrayList<>(entries.size());
        for (BatchJob entry : entries) {
            try {
                jobs.add(entry.toJobInfo());
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed batch queue entry {}: {}", entry.jobId(), e.getMessage());
            }
        }
        return jobs;
    }

    static JobState parseState(String state) {
        if (state == null) {
            return null;
        }
        return switch (state.trim().toUpperCase(Locale.ROOT)) {
            case "PENDING", "QUEUED", "Q" -> JobState.PENDING;
            case "RUNNING", "R" -> JobState.RUNNING;
            case "FINISHED", "COMPLETED", "C" -> JobState.FINISHED;
            default -> JobState.OTHER;
        };
    }

    private static Duration resolveTimeout(Duration candidate, Duration fallback) {
        if (candidate == null || candidate.isZero() || candidate.isNegative()) {
            return fallback;
        }
        return candidate;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BatchJob(
        @JsonProperty("jobid") String jobId,
        @JsonProperty("state") String state,
        @JsonProperty("exec_node_name") String execNodeName,
        @JsonProperty("submitted_at") Instant submittedAt,
        @JsonProperty("running_at") Instant runningAt,
        @JsonProperty("queue") String queue) {

        JobInfo toJobInfo() {
            return new JobInfo(jobId, parseState(state), execNodeName, submittedAt, runningAt, queue);
        }
    }
}
