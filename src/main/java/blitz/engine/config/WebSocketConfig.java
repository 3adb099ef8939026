package blitz.engine.config;

import blitz.engine.service.transport.EngineWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Slf4j
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final EngineWebSocketHandler<?, ?> engineWebSocketHandler;
    private final EngineProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(engineWebSocketHandler, properties.getWebSocketPath())
                .setAllowedOrigins("*");
        log.info("Engine WebSocket registered at {} ({} mode)", properties.getWebSocketPath(),
                properties.getMode().name().toLowerCase());
    }
}
