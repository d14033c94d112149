package app.anvil.generation.domain.type;

public enum DocumentStatus {
    Draft,
    Generating,
    Completed,
    Failed;

    public boolean isTerminal() {
        return this == Completed || this == Failed;
    }
}
