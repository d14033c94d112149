package app.anvil.generation.domain.type;

public enum JobStatus {
    pending,
    processing,
    completed,
    failed;

    public boolean isTerminal() {
        return this == completed || this == failed;
    }
}
