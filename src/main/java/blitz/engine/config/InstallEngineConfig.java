package blitz.engine.config;

import blitz.engine.dto.ClientCommand;
import blitz.engine.dto.ServerEvent;
import blitz.engine.model.InstallState;
import blitz.engine.service.engine.BuildLogService;
import blitz.engine.service.engine.EventBus;
import blitz.engine.service.engine.InstallCommandProcessor;
import blitz.engine.service.engine.InstallEngine;
import blitz.engine.service.engine.StateStore;
import blitz.engine.service.process.ProcessSupervisor;
import blitz.engine.service.system.DiskService;
import blitz.engine.service.system.ProjectService;
import blitz.engine.service.system.SystemCheckService;
import blitz.engine.service.system.SystemInfoService;
import blitz.engine.service.transport.EngineWebSocketHandler;
import blitz.engine.service.transport.ProtocolCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * Wires the install protocol engine for a machine booted from the installer image.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "blitz.engine", name = "mode", havingValue = "install", matchIfMissing = true)
public class InstallEngineConfig {

    @Bean
    public InstallEngine installEngine(EngineProperties properties,
                                       SystemInfoService systemInfoService,
                                       SystemCheckService systemCheckService,
                                       DiskService diskService,
                                       ProjectService projectService,
                                       ProcessSupervisor processSupervisor,
                                       BuildLogService buildLogService,
                                       ExecutorService engineExecutor) {
        StateStore<InstallState> store = new StateStore<>(InstallState.IDLE);
        EventBus<ServerEvent> bus = new EventBus<>(properties.getEventCapacity());
        InstallCommandProcessor processor = new InstallCommandProcessor(store, bus, systemInfoService,
                systemCheckService, diskService, projectService, processSupervisor, buildLogService,
                properties, engineExecutor);
        log.info("Install engine created for work dir {}", properties.getWorkDir());
        return new InstallEngine(store, bus, processor);
    }

    @Bean
    public EngineWebSocketHandler<ClientCommand, ServerEvent> engineWebSocketHandler(InstallEngine installEngine,
                                                                                      ProtocolCodec protocolCodec,
                                                                                      ExecutorService engineExecutor) {
        return new EngineWebSocketHandler<>(installEngine, protocolCodec, engineExecutor);
    }
}
