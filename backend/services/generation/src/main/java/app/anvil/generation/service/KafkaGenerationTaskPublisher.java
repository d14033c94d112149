package app.anvil.generation.service;

import app.anvil.generation.client.generator.GeneratorProps;
import app.anvil.generation.domain.type.JobEventType;
import app.anvil.generation.events.JobEventPublisher;
import app.anvil.generation.storage.JobUpdate;
import app.anvil.generation.storage.TenantScopedGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queue transport: the job is marked queued, then the task is published keyed by job id. The job
 * stays pending until {@link GenerationTaskListener} picks it up.
 */
@Component
@ConditionalOnProperty(prefix = "app.generator", name = "transport", havingValue = "queue")
public class KafkaGenerationTaskPublisher implements GenerationTaskPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaGenerationTaskPublisher.class);

    static final String QUEUED = "Queued for generation";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final GeneratorProps props;
    private final TenantScopedGateway gateway;
    private final GenerationInvoker invoker;
    private final JobEventPublisher eventPublisher;

    public KafkaGenerationTaskPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                        ObjectMapper objectMapper,
                                        GeneratorProps props,
                                        TenantScopedGateway gateway,
                                        GenerationInvoker invoker,
                                        JobEventPublisher eventPublisher) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.props = props;
        this.gateway = gateway;
        this.invoker = invoker;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void submit(GenerationTask task) {
        gateway.withTenantScope(task.tenantId(), scope -> scope.jobs().updateJob(task.jobId(), JobUpdate.description(QUEUED)));
        try {
            String body = objectMapper.writeValueAsString(task);
            kafkaTemplate.send(props.topic(), task.jobId().toString(), body)
                    .get(props.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (JsonProcessingException | KafkaException | ExecutionException | TimeoutException ex) {
            log.warn("Failed to queue generation task jobId={} topic={}", task.jobId(), props.topic(), ex);
            invoker.recordFailure(task, "Queue publish failed: " + ex.getMessage());
            return;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            invoker.recordFailure(task, "Queue publish interrupted");
            return;
        }
        log.info("Queued generation task jobId={} kind={} topic={}", task.jobId(), task.kind(), props.topic());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", task.jobId().toString());
        data.put("status", "pending");
        data.put("description", QUEUED);
        eventPublisher.publish(task.jobId(), JobEventType.progress, data);
    }
}
