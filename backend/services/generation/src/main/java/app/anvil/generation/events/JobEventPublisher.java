package app.anvil.generation.events;

import app.anvil.generation.domain.type.JobEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Best-effort delivery of job events to the sessions subscribed to the job's channel. A session
 * that fails a send is dropped from every channel.
 */
@Component
public class JobEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JobEventPublisher.class);

    private final JobChannelRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JobEventPublisher(JobChannelRegistry registry, ObjectMapper objectMapper, Clock clock) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void publish(UUID jobId, JobEventType type, Map<String, Object> data) {
        String channel = JobChannels.of(jobId);
        var sessions = registry.sessions(channel);
        if (sessions.isEmpty()) {
            log.debug("No subscribers for event jobId={} type={}", jobId, type);
            return;
        }
        TextMessage message = encode(new JobEvent(type, channel, clock.instant(), data == null ? Map.of() : data));
        if (message == null) {
            return;
        }
        for (WebSocketSession session : sessions) {
            send(session, message);
        }
        log.debug("Published event jobId={} type={} subscribers={}", jobId, type, sessions.size());
    }

    void sendDirect(WebSocketSession session, JobEvent event) {
        TextMessage message = encode(event);
        if (message != null) {
            send(session, message);
        }
    }

    private TextMessage encode(JobEvent event) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException ex) {
            log.warn("Failed to encode job event channel={} type={}", event.channel(), event.type(), ex);
            return null;
        }
    }

    private void send(WebSocketSession session, TextMessage message) {
        if (!session.isOpen()) {
            registry.removeSession(session);
            return;
        }
        try {
            session.sendMessage(message);
        } catch (IOException | RuntimeException ex) {
            log.info("Dropping websocket session sessionId={} reason={}", session.getId(), ex.getMessage());
            registry.removeSession(session);
            closeQuietly(session);
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close();
        } catch (IOException ex) {
            log.debug("Close failed for websocket session sessionId={}", session.getId(), ex);
        }
    }
}
