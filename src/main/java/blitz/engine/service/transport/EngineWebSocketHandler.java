package blitz.engine.service.transport;

import blitz.engine.service.engine.Engine;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

@Slf4j
public class EngineWebSocketHandler<C, E> extends TextWebSocketHandler {
    private final Engine<C, E> engine;
    private final ProtocolCodec codec;
    private final ExecutorService executor;
    private final Map<String, EngineSession<C, E>> sessions = new ConcurrentHashMap<>();

    public EngineWebSocketHandler(Engine<C, E> engine, ProtocolCodec codec, ExecutorService executor) {
        this.engine = engine;
        this.codec = codec;
        this.executor = executor;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        EngineSession<C, E> engineSession = new EngineSession<>(session, engine, codec, executor);
        sessions.put(session.getId(), engineSession);
        log.info("WebSocket connection established: {}. Total sessions: {}", session.getId(), sessions.size());
        engineSession.start();
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        EngineSession<C, E> engineSession = sessions.get(session.getId());
        if (engineSession == null) {
            log.warn("Received message for unknown session {}", session.getId());
            return;
        }
        engineSession.onFrame(message.getPayload());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WebSocket transport error for session {}: {}", session.getId(), exception.getMessage());
        endSession(session);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        log.info("WebSocket connection closed: {} with status: {}", session.getId(), status);
        endSession(session);
    }

    private void endSession(WebSocketSession session) {
        EngineSession<C, E> engineSession = sessions.remove(session.getId());
        if (engineSession != null) {
            engineSession.stop();
        }
    }
}
