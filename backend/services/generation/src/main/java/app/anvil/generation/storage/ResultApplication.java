package app.anvil.generation.storage;

public enum ResultApplication {
    /** Document moved from a non-terminal status to the result status. */
    APPLIED,
    /** Document was already completed; content was overwritten. */
    CONTENT_REFRESHED,
    /** Document was terminal and the result was dropped. */
    IGNORED
}
