package app.anvil.generation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.generator", name = "transport", havingValue = "queue")
public class GenerationTaskListener {

    private static final Logger log = LoggerFactory.getLogger(GenerationTaskListener.class);

    private final ObjectMapper objectMapper;
    private final GenerationInvoker invoker;

    public GenerationTaskListener(ObjectMapper objectMapper, GenerationInvoker invoker) {
        this.objectMapper = objectMapper;
        this.invoker = invoker;
    }

    @KafkaListener(
            topics = "${app.generator.topic:generation-tasks}",
            groupId = "${spring.application.name:generation}-tasks"
    )
    public void onTask(@Payload String body,
                       @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String key) {
        GenerationTask task;
        try {
            task = objectMapper.readValue(body, GenerationTask.class);
        } catch (JsonProcessingException ex) {
            log.error("Discarding unreadable generation task key={} error={}", key, ex.getOriginalMessage());
            return;
        }
        log.debug("Received generation task jobId={} kind={}", task.jobId(), task.kind());
        invoker.invoke(task);
    }
}
