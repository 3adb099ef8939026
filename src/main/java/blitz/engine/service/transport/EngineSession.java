package blitz.engine.service.transport;

import blitz.engine.service.engine.Engine;
import blitz.engine.service.engine.EngineConnection;
import blitz.engine.service.engine.Subscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connects one WebSocket observer to the engine.
 * <p>
 * The first frame sent is always the state snapshot taken when the session
 * subscribed. After that an outbound task forwards bus events until the session
 * stops. Inbound frames are decoded and handed to the engine on the caller's
 * thread. Only the outbound task writes to the socket once it has started.
 */
@Slf4j
public class EngineSession<C, E> {
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final WebSocketSession session;
    private final Engine<C, E> engine;
    private final ProtocolCodec codec;
    private final ExecutorService executor;
    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile Subscription<E> subscription;
    private volatile Future<?> outbound;

    public EngineSession(WebSocketSession session, Engine<C, E> engine, ProtocolCodec codec, ExecutorService executor) {
        this.session = session;
        this.engine = engine;
        this.codec = codec;
        this.executor = executor;
    }

    public String getId() {
        return session.getId();
    }

    public void start() {
        EngineConnection<E> connection = engine.connect();
        subscription = connection.subscription();
        try {
            send(connection.snapshot());
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send initial state to session {}: {}", getId(), e.getMessage());
            close(CloseStatus.SERVER_ERROR);
            stop();
            return;
        }

        outbound = executor.submit(this::forwardEvents);
        if (stopped.get()) {
            outbound.cancel(true);
        }
    }

    public void onFrame(String payload) {
        C command;
        try {
            command = codec.decode(payload, engine.getCommandType());
        } catch (JsonProcessingException e) {
            log.warn("Dropping undecodable frame from session {}: {}", getId(), e.getOriginalMessage());
            return;
        }
        log.debug("Received command from session {}: {}", getId(), command);
        engine.handle(command);
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        Future<?> task = outbound;
        if (task != null) {
            task.cancel(true);
        }
        Subscription<E> sub = subscription;
        if (sub != null) {
            sub.close();
        }
        log.debug("Session {} stopped", getId());
    }

    public boolean isStopped() {
        return stopped.get();
    }

    private void forwardEvents() {
        try {
            while (!stopped.get()) {
                E event = subscription.poll(POLL_INTERVAL);
                long lagged = subscription.takeLagged();
                if (lagged > 0) {
                    log.warn("Session {} lagged behind, {} events were dropped", getId(), lagged);
                }
                if (event != null) {
                    send(event);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | IllegalStateException e) {
            log.error("Error sending event to session {}: {}", getId(), e.getMessage());
            close(CloseStatus.SERVER_ERROR);
            stop();
        }
    }

    private void send(E event) throws IOException {
        String json = codec.encode(event);
        session.sendMessage(new TextMessage(json));
    }

    private void close(CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            log.debug("Error closing session {}: {}", getId(), e.getMessage());
        }
    }
}
