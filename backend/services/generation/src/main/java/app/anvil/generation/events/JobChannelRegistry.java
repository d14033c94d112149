package app.anvil.generation.events;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel name to subscribed sessions. Empty channels are dropped.
 */
@Component
public class JobChannelRegistry {

    private final Map<String, Set<WebSocketSession>> channels = new ConcurrentHashMap<>();

    public void subscribe(String channel, WebSocketSession session) {
        channels.computeIfAbsent(channel, key -> ConcurrentHashMap.newKeySet()).add(session);
    }

    public void unsubscribe(String channel, WebSocketSession session) {
        channels.computeIfPresent(channel, (key, sessions) -> {
            sessions.removeIf(existing -> existing.getId().equals(session.getId()));
            return sessions.isEmpty() ? null : sessions;
        });
    }

    public void removeSession(WebSocketSession session) {
        for (String channel : List.copyOf(channels.keySet())) {
            unsubscribe(channel, session);
        }
    }

    public List<WebSocketSession> sessions(String channel) {
        Set<WebSocketSession> sessions = channels.get(channel);
        return sessions == null ? List.of() : List.copyOf(sessions);
    }

    public int channelCount() {
        return channels.size();
    }
}
