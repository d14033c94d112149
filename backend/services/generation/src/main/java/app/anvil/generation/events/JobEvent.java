package app.anvil.generation.events;

import app.anvil.generation.domain.type.JobEventType;

import java.time.Instant;
import java.util.Map;

public record JobEvent(
        JobEventType type,
        String channel,
        Instant timestamp,
        Map<String, Object> data
) {
}
