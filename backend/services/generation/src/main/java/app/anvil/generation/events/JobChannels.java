package app.anvil.generation.events;

import java.util.Optional;
import java.util.UUID;

public final class JobChannels {

    static final String PREFIX = "job:";

    private JobChannels() {
    }

    public static String of(UUID jobId) {
        return PREFIX + jobId;
    }

    public static Optional<UUID> parse(String channel) {
        if (channel == null || !channel.startsWith(PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(channel.substring(PREFIX.length())));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
