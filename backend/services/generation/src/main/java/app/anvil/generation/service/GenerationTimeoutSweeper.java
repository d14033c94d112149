package app.anvil.generation.service;

import app.anvil.generation.config.GenerationProps;
import app.anvil.generation.domain.type.JobEventType;
import app.anvil.generation.domain.type.TimeoutPolicy;
import app.anvil.generation.events.JobEventPublisher;
import app.anvil.generation.storage.StaleDocument;
import app.anvil.generation.storage.TenantScopedGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Resolves generations that never got a result. Every promotion is a conditional
 * {@code update ... returning}, so a row raced by a webhook is promoted by exactly one side.
 */
@Service
@ConditionalOnProperty(prefix = "app.generation.sweeper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GenerationTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(GenerationTimeoutSweeper.class);

    static final String TIMED_OUT = "Generation timed out; content may be incomplete";
    static final String TIMED_OUT_FAILED = "Error: Generation timed out";

    private final TenantScopedGateway gateway;
    private final JobEventPublisher eventPublisher;
    private final GenerationProps props;
    private final Clock clock;

    public GenerationTimeoutSweeper(TenantScopedGateway gateway,
                                    JobEventPublisher eventPublisher,
                                    GenerationProps props,
                                    Clock clock) {
        this.gateway = gateway;
        this.eventPublisher = eventPublisher;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.generation.sweeper.interval-ms:30000}")
    public void sweep() {
        try {
            sweepOnce();
        } catch (RuntimeException ex) {
            log.error("Timeout sweep failed", ex);
        }
    }

    public SweepResult sweepOnce() {
        TimeoutPolicy policy = props.timeoutPolicy();
        Instant cutoff = clock.instant().minus(props.timeout());
        String note = policy == TimeoutPolicy.complete ? TIMED_OUT : TIMED_OUT_FAILED;

        SweepResult result = gateway.withSystemScope(scope -> {
            List<StaleDocument> documents = scope.documents().promoteStale(cutoff, policy.documentStatus());
            List<UUID> jobs = scope.jobs().promoteStale(cutoff, policy.jobStatus(), note);
            int ideas = scope.ideas().promoteStale(cutoff, policy.ideaStatus());
            return new SweepResult(documents, jobs, ideas);
        });

        if (result.isEmpty()) {
            return result;
        }
        log.info("Timeout sweep promoted documents={} jobs={} ideas={} policy={}",
                result.documents().size(), result.jobIds().size(), result.ideas(), policy);

        JobEventType type = policy == TimeoutPolicy.complete ? JobEventType.done : JobEventType.error;
        for (UUID jobId : result.jobIds()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("jobId", jobId.toString());
            data.put("status", policy.jobStatus().name());
            data.put("message", note);
            data.put("timedOut", true);
            eventPublisher.publish(jobId, type, data);
        }
        return result;
    }

    public record SweepResult(List<StaleDocument> documents, List<UUID> jobIds, int ideas) {
        public boolean isEmpty() {
            return documents.isEmpty() && jobIds.isEmpty() && ideas == 0;
        }
    }
}
