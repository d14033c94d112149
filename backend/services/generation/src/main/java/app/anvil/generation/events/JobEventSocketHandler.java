package app.anvil.generation.events;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.type.JobEventType;
import app.anvil.generation.security.CurrentTenantProvider;
import app.anvil.generation.storage.TenantScopedGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code /ws/jobs}: clients subscribe to {@code job:<id>} channels of jobs visible to their tenant.
 */
@Component
public class JobEventSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(JobEventSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final JobChannelRegistry registry;
    private final JobEventPublisher publisher;
    private final TenantScopedGateway gateway;
    private final CurrentTenantProvider tenantProvider;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public JobEventSocketHandler(JobChannelRegistry registry,
                                 JobEventPublisher publisher,
                                 TenantScopedGateway gateway,
                                 CurrentTenantProvider tenantProvider,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.registry = registry;
        this.publisher = publisher;
        this.gateway = gateway;
        this.tenantProvider = tenantProvider;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        if (tenantOf(session).isEmpty()) {
            log.info("Rejecting websocket without tenant sessionId={}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    @Override
    protected void handleTextMessage(WebSocketSession rawSession, TextMessage message) {
        WebSocketSession session = sessions.getOrDefault(rawSession.getId(), rawSession);
        JsonNode body;
        try {
            body = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            sendError(session, null, "Invalid message");
            return;
        }
        String action = body.path("action").asText("");
        String channel = body.path("channel").asText(null);
        switch (action) {
            case "subscribe" -> subscribe(session, channel);
            case "unsubscribe" -> {
                if (JobChannels.parse(channel).isEmpty()) {
                    sendError(session, channel, "Invalid channel format");
                    return;
                }
                registry.unsubscribe(channel, session);
            }
            default -> sendError(session, channel, "Unknown action");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSession tracked = sessions.remove(session.getId());
        registry.removeSession(tracked == null ? session : tracked);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.info("Websocket transport error sessionId={} reason={}", session.getId(), exception.getMessage());
        WebSocketSession tracked = sessions.remove(session.getId());
        registry.removeSession(tracked == null ? session : tracked);
    }

    private void subscribe(WebSocketSession session, String channel) {
        Optional<UUID> jobId = JobChannels.parse(channel);
        if (jobId.isEmpty()) {
            sendError(session, channel, "Invalid channel format");
            return;
        }
        Optional<UUID> tenantId = tenantOf(session);
        Optional<GenerationJobEntity> job = tenantId.flatMap(tenant ->
                gateway.withTenantScope(tenant, scope -> scope.jobs().getJob(jobId.get())));
        if (job.isEmpty()) {
            sendError(session, channel, "Unauthorized channel");
            return;
        }
        registry.subscribe(channel, session);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.get().getId().toString());
        data.put("status", job.get().getStatus().name());
        data.put("description", job.get().getDescription());
        publisher.sendDirect(session, new JobEvent(JobEventType.status, channel, clock.instant(), data));
    }

    private void sendError(WebSocketSession session, String channel, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        publisher.sendDirect(session, new JobEvent(JobEventType.error, channel, clock.instant(), data));
    }

    private Optional<UUID> tenantOf(WebSocketSession session) {
        if (session.getPrincipal() instanceof JwtAuthenticationToken token) {
            return tenantProvider.getTenantId(token.getToken());
        }
        return Optional.empty();
    }
}
