package blitz.engine.config;

import blitz.engine.dto.SystemClientCommand;
import blitz.engine.dto.SystemServerEvent;
import blitz.engine.model.SystemState;
import blitz.engine.service.engine.BuildLogService;
import blitz.engine.service.engine.EventBus;
import blitz.engine.service.engine.StateStore;
import blitz.engine.service.engine.SystemCommandProcessor;
import blitz.engine.service.engine.SystemEngine;
import blitz.engine.service.process.ProcessSupervisor;
import blitz.engine.service.system.PowerService;
import blitz.engine.service.system.ProjectService;
import blitz.engine.service.transport.EngineWebSocketHandler;
import blitz.engine.service.transport.ProtocolCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * Wires the update protocol engine for an installed system.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "blitz.engine", name = "mode", havingValue = "system")
public class SystemEngineConfig {

    @Bean
    public SystemEngine systemEngine(EngineProperties properties,
                                     ProjectService projectService,
                                     PowerService powerService,
                                     ProcessSupervisor processSupervisor,
                                     BuildLogService buildLogService,
                                     ExecutorService engineExecutor) {
        StateStore<SystemState> store = new StateStore<>(SystemState.IDLE);
        EventBus<SystemServerEvent> bus = new EventBus<>(properties.getEventCapacity());
        SystemCommandProcessor processor = new SystemCommandProcessor(store, bus, projectService, powerService,
                processSupervisor, buildLogService, properties, engineExecutor);
        log.info("System engine created for work dir {}", properties.getWorkDir());
        return new SystemEngine(store, bus, processor);
    }

    @Bean
    public EngineWebSocketHandler<SystemClientCommand, SystemServerEvent> engineWebSocketHandler(
            SystemEngine systemEngine, ProtocolCodec protocolCodec, ExecutorService engineExecutor) {
        return new EngineWebSocketHandler<>(systemEngine, protocolCodec, engineExecutor);
    }
}
