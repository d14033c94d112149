package app.anvil.generation.domain.type;

/**
 * What the sweeper does with a generation that outlived the timeout.
 */
public enum TimeoutPolicy {
    /** Promote to completed; the generator may still write its artifact later. */
    complete,
    fail;

    public JobStatus jobStatus() {
        return this == complete ? JobStatus.completed : JobStatus.failed;
    }

    public DocumentStatus documentStatus() {
        return this == complete ? DocumentStatus.Completed : DocumentStatus.Failed;
    }

    public IdeaStatus ideaStatus() {
        return this == complete ? IdeaStatus.Completed : IdeaStatus.Draft;
    }
}
