package app.anvil.generation.domain.type;

public enum JobEventType {
    status,
    progress,
    done,
    error
}
