package app.anvil.generation.domain.type;

public enum IdeaStatus {
    Draft,
    Generating,
    Completed
}
