package app.anvil.generation.service;

import app.anvil.generation.client.generator.GeneratorClient;
import app.anvil.generation.client.generator.GeneratorInvocationException;
import app.anvil.generation.client.generator.GeneratorResponse;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.IdeaStatus;
import app.anvil.generation.domain.type.JobEventType;
import app.anvil.generation.domain.type.JobStatus;
import app.anvil.generation.events.JobEventPublisher;
import app.anvil.generation.storage.DocumentResult;
import app.anvil.generation.storage.TenantScopedGateway;
import app.anvil.generation.support.correlation.CorrelationIdExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls the generator for a committed task and records the outcome. Never called inside a
 * gateway transaction.
 */
@Service
public class GenerationInvoker {

    private static final Logger log = LoggerFactory.getLogger(GenerationInvoker.class);

    static final String STARTED = "Generation started";
    static final String STARTED_WITHOUT_ID = "Generation started, no id returned";

    private final GeneratorClient generatorClient;
    private final CorrelationIdExtractor correlationIdExtractor;
    private final TenantScopedGateway gateway;
    private final JobEventPublisher eventPublisher;

    public GenerationInvoker(GeneratorClient generatorClient,
                             CorrelationIdExtractor correlationIdExtractor,
                             TenantScopedGateway gateway,
                             JobEventPublisher eventPublisher) {
        this.generatorClient = generatorClient;
        this.correlationIdExtractor = correlationIdExtractor;
        this.gateway = gateway;
        this.eventPublisher = eventPublisher;
    }

    public void invoke(GenerationTask task) {
        GeneratorResponse response;
        try {
            response = generatorClient.invoke(task.toRequest());
        } catch (GeneratorInvocationException ex) {
            log.warn("Generator call failed jobId={} kind={} error={}", task.jobId(), task.kind(), safeMessage(ex.getMessage()));
            recordFailure(task, ex.getMessage());
            return;
        }

        String externalId = correlationIdExtractor.extract(response.body()).orElse(null);
        String description = externalId == null ? STARTED_WITHOUT_ID : STARTED;
        boolean started = gateway.withTenantScope(task.tenantId(), scope -> {
            if (externalId != null && task.documentId() != null) {
                scope.documents().recordExternalId(task.documentId(), externalId);
            }
            return scope.jobs().markProcessing(task.jobId(), description);
        });

        if (!started) {
            log.info("Job advanced before generator acknowledged jobId={} kind={}", task.jobId(), task.kind());
            return;
        }
        log.info("Generation started jobId={} kind={} externalId={}", task.jobId(), task.kind(), externalId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", task.jobId().toString());
        data.put("status", JobStatus.processing.name());
        data.put("description", description);
        data.put("externalId", externalId);
        eventPublisher.publish(task.jobId(), JobEventType.status, data);
    }

    /**
     * Fails the job and its document. The idea goes back to draft for Lean Canvas.
     */
    public void recordFailure(GenerationTask task, String message) {
        String description = "Error: " + safeMessage(message);
        boolean failed = gateway.withTenantScope(task.tenantId(), scope -> {
            boolean moved = scope.jobs().promoteIfActive(task.jobId(), JobStatus.failed, description);
            if (!moved) {
                return false;
            }
            if (task.documentId() != null) {
                scope.documents().applyResult(task.documentId(), DocumentResult.failed(null));
            }
            if (task.kind() == DocumentKind.LeanCanvas) {
                scope.ideas().transition(task.ideaId(), IdeaStatus.Generating, IdeaStatus.Draft);
            }
            return true;
        });
        if (!failed) {
            log.info("Job no longer active, failure not recorded jobId={}", task.jobId());
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", task.jobId().toString());
        data.put("status", JobStatus.failed.name());
        data.put("message", description);
        eventPublisher.publish(task.jobId(), JobEventType.error, data);
    }

    static String safeMessage(String message) {
        if (message == null) {
            return "unknown error";
        }
        String trimmed = message.replaceAll("\\s+", " ").trim();
        if (trimmed.isEmpty()) {
            return "unknown error";
        }
        return trimmed.length() > 200 ? trimmed.substring(0, 200) : trimmed;
    }
}
