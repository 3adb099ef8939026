package blitz.engine.service.engine;

import blitz.engine.config.EngineProperties;
import blitz.engine.dto.SystemClientCommand;
import blitz.engine.dto.SystemServerEvent;
import blitz.engine.model.SystemState;
import blitz.engine.service.process.LocalProcessSupervisor;
import blitz.engine.service.system.PowerService;
import blitz.engine.service.system.ProjectService;
import blitz.engine.service.system.SystemCommandException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Runs real shell commands through the local supervisor; the processor itself
 * runs the switch on the calling thread so each test observes the final state.
 */
@Timeout(30)
@DisabledOnOs(OS.WINDOWS)
@ExtendWith(MockitoExtension.class)
class SystemCommandProcessorTest {

    @Mock
    private ProjectService projectService;
    @Mock
    private PowerService powerService;

    private ExecutorService pumpExecutor;
    private StateStore<SystemState> store;
    private Subscription<SystemServerEvent> events;
    private BuildLogService buildLog;
    private EngineProperties properties;
    private SystemCommandProcessor processor;

    @BeforeEach
    void setUp() {
        pumpExecutor = Executors.newCachedThreadPool();
        store = new StateStore<>(SystemState.IDLE);
        EventBus<SystemServerEvent> bus = new EventBus<>(1000);
        events = bus.subscribe();
        buildLog = new BuildLogService(1000);
        properties = new EngineProperties();
        properties.setWorkDir("/tmp/work");
        processor = new SystemCommandProcessor(store, bus, projectService, powerService,
                new LocalProcessSupervisor(pumpExecutor), buildLog, properties, Runnable::run);
    }

    @AfterEach
    void tearDown() {
        pumpExecutor.shutdownNow();
    }

    @Test
    void successfulSwitch_streamsLogsAndReturnsToIdle() throws Exception {
        switchCommand("echo building; echo done");

        processor.handle(new SystemClientCommand.SwitchConfig());

        List<SystemServerEvent> published = drain();
        assertEquals(List.of(
                new SystemServerEvent.StateChanged(new SystemState.Switching()),
                new SystemServerEvent.UpdateLog("building"),
                new SystemServerEvent.UpdateLog("done"),
                new SystemServerEvent.StateChanged(SystemState.IDLE)
        ), published);
        assertEquals(SystemState.IDLE, store.read());
        verify(projectService).markChangesApplied();
    }

    @Test
    void failedSwitch_reportsExitCodeAndEndsInFailureState() throws Exception {
        switchCommand("echo building; exit 7");

        processor.handle(new SystemClientCommand.SwitchConfig());

        List<SystemServerEvent> published = drain();
        assertEquals(new SystemServerEvent.StateChanged(new SystemState.Switching()), published.get(0));
        assertEquals(new SystemServerEvent.UpdateLog("building"), published.get(1));
        assertEquals(new SystemServerEvent.Error("Switch to new config failed with exit code: 7"),
                published.get(published.size() - 2));
        assertEquals(new SystemServerEvent.StateChanged(
                        new SystemState.UpdateFailed("Switch to new config failed with exit code: 7")),
                published.get(published.size() - 1));

        assertInstanceOf(SystemState.UpdateFailed.class, store.read());
        assertNotEquals(SystemState.IDLE, store.read());
        verify(projectService, never()).markChangesApplied();
    }

    @Test
    void stderrLines_arePrefixed() throws Exception {
        switchCommand("echo oops >&2");

        processor.handle(new SystemClientCommand.SwitchConfig());

        assertTrue(drain().contains(new SystemServerEvent.UpdateLog("[STDERR] oops")));
        assertEquals(List.of("[STDERR] oops"), buildLog.getHistory());
    }

    @Test
    void missingSwitchExecutable_failsSwitch() throws Exception {
        properties.getUpdate().setSwitchCommand(List.of("/nonexistent/nixblitz-test", "apply"));

        processor.handle(new SystemClientCommand.SwitchConfig());

        SystemState.UpdateFailed failed = assertInstanceOf(SystemState.UpdateFailed.class, store.read());
        assertTrue(failed.message().startsWith("Failed to spawn command"), failed.message());
        verify(projectService, never()).markChangesApplied();
    }

    @Test
    void switch_canBeRetriedAfterFailure() throws Exception {
        switchCommand("exit 1");
        processor.handle(new SystemClientCommand.SwitchConfig());
        assertInstanceOf(SystemState.UpdateFailed.class, store.read());

        switchCommand("true");
        processor.handle(new SystemClientCommand.SwitchConfig());

        assertEquals(SystemState.IDLE, store.read());
    }

    @Test
    void markAppliedFailure_isReportedButSwitchStillEndsIdle() throws Exception {
        switchCommand("true");
        doThrow(new IOException("read-only file system")).when(projectService).markChangesApplied();

        processor.handle(new SystemClientCommand.SwitchConfig());

        List<SystemServerEvent> published = drain();
        assertTrue(published.stream().anyMatch(SystemServerEvent.Error.class::isInstance));
        assertEquals(new SystemServerEvent.StateChanged(SystemState.IDLE), published.get(published.size() - 1));
    }

    @Test
    void commandsWhileSwitching_areRejected() throws Exception {
        SystemState switching = new SystemState.Switching();
        store.replace(switching);

        processor.handle(new SystemClientCommand.SwitchConfig());
        processor.handle(new SystemClientCommand.DevReset());
        processor.handle(new SystemClientCommand.Reboot());

        List<SystemServerEvent> published = drain();
        assertEquals(3, published.size());
        assertTrue(published.stream().allMatch(SystemServerEvent.Error.class::isInstance));
        assertSame(switching, store.read());
        verifyNoInteractions(powerService);
    }

    @Test
    void devReset_clearsFailure() throws Exception {
        store.replace(new SystemState.UpdateFailed("boom"));
        buildLog.append("old");

        processor.handle(new SystemClientCommand.DevReset());

        assertEquals(SystemState.IDLE, store.read());
        assertTrue(buildLog.getHistory().isEmpty());
        assertEquals(List.of(new SystemServerEvent.StateChanged(SystemState.IDLE)), drain());
    }

    @Test
    void rebootFailure_isReportedAsError() throws Exception {
        doThrow(new SystemCommandException("systemctl failed")).when(powerService).reboot();

        processor.handle(new SystemClientCommand.Reboot());

        assertEquals(List.of(new SystemServerEvent.Error("Reboot failed: systemctl failed")), drain());
        assertEquals(SystemState.IDLE, store.read());
    }

    @Test
    void unsupportedCommand_reportsNotImplemented() throws Exception {
        processor.handle(new SystemClientCommand.Unsupported());

        assertEquals(List.of(new SystemServerEvent.Error("Command not implemented")), drain());
    }

    private void switchCommand(String script) {
        properties.getUpdate().setSwitchCommand(List.of("sh", "-c", script));
    }

    private List<SystemServerEvent> drain() throws InterruptedException {
        List<SystemServerEvent> published = new ArrayList<>();
        SystemServerEvent event;
        while ((event = events.poll(Duration.ZERO)) != null) {
            published.add(event);
        }
        return published;
    }
}
