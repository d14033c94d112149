package app.anvil.generation.config;

import app.anvil.generation.events.JobEventSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final JobEventSocketHandler handler;
    private final CorsProps corsProps;

    public WebSocketConfig(JobEventSocketHandler handler, CorsProps corsProps) {
        this.handler = handler;
        this.corsProps = corsProps;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        List<String> origins = (corsProps.origins() == null || corsProps.origins().isEmpty())
                ? List.of("http://localhost:5173")
                : corsProps.origins();
        registry.addHandler(handler, "/ws/jobs")
                .setAllowedOrigins(origins.toArray(String[]::new));
    }
}
