package app.anvil.generation.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.generator", name = "transport", havingValue = "http", matchIfMissing = true)
public class DirectGenerationTaskPublisher implements GenerationTaskPublisher {

    private final GenerationInvoker invoker;

    public DirectGenerationTaskPublisher(GenerationInvoker invoker) {
        this.invoker = invoker;
    }

    @Override
    public void submit(GenerationTask task) {
        invoker.invoke(task);
    }
}
