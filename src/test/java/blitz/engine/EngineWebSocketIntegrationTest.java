package blitz.engine;

import blitz.engine.dto.ClientCommand;
import blitz.engine.dto.ServerEvent;
import blitz.engine.model.InstallState;
import blitz.engine.service.transport.ProtocolCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class EngineWebSocketIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private ProtocolCodec codec;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private WebSocketSession session;

    @DynamicPropertySource
    static void engineProperties(DynamicPropertyRegistry registry) {
        registry.add("blitz.engine.work-dir", () -> System.getProperty("java.io.tmpdir"));
    }

    @BeforeEach
    void connect() throws Exception {
        session = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                        frames.add(message.getPayload());
                    }
                }, "ws://127.0.0.1:" + port + "/ws")
                .get(10, TimeUnit.SECONDS);
    }

    @AfterEach
    void disconnect() throws Exception {
        send(new ClientCommand.DevReset());
        ServerEvent event;
        do {
            event = nextEvent();
        } while (!new ServerEvent.StateChanged(InstallState.IDLE).equals(event));
        session.close(CloseStatus.NORMAL);
    }

    @Test
    void newObserver_firstReceivesCurrentState() throws Exception {
        assertEquals(new ServerEvent.StateChanged(InstallState.IDLE), nextEvent());
    }

    @Test
    void systemCheck_isBroadcastAsTwoTransitions() throws Exception {
        assertEquals(new ServerEvent.StateChanged(InstallState.IDLE), nextEvent());

        send(new ClientCommand.PerformSystemCheck());

        ServerEvent checking = nextEvent();
        assertInstanceOf(InstallState.PerformingCheck.class, ((ServerEvent.StateChanged) checking).state());
        ServerEvent completed = nextEvent();
        InstallState.SystemCheckCompleted result = assertInstanceOf(InstallState.SystemCheckCompleted.class,
                ((ServerEvent.StateChanged) completed).state());
        assertFalse(result.result().summary().cpus().isEmpty());
    }

    @Test
    void unknownCommand_isAnsweredWithError() throws Exception {
        nextEvent();

        session.sendMessage(new TextMessage("{\"type\":\"FormatDisk\"}"));

        assertEquals(new ServerEvent.Error("Command not implemented"), nextEvent());
    }

    @Test
    void statusEndpoint_reportsModeAndObservers() throws Exception {
        nextEvent();

        ResponseEntity<String> response = restTemplate.getForEntity("/api/engine/status", String.class);

        assertTrue(response.getStatusCode().is2xxSuccessful());
        JsonNode body = objectMapper.readTree(response.getBody());
        assertTrue(body.path("success").asBoolean());
        assertEquals("install", body.path("data").path("mode").asText());
        assertTrue(body.path("data").path("subscribers").asInt() >= 1);
    }

    private void send(ClientCommand command) throws Exception {
        session.sendMessage(new TextMessage(codec.encode(command)));
    }

    private ServerEvent nextEvent() throws Exception {
        String frame = frames.poll(10, TimeUnit.SECONDS);
        assertNotNull(frame, "no event received");
        return codec.decode(frame, ServerEvent.class);
    }
}
