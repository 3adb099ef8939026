package blitz.engine.service.engine;

import blitz.engine.config.EngineProperties;
import blitz.engine.dto.SystemClientCommand;
import blitz.engine.dto.SystemServerEvent;
import blitz.engine.model.ProcessOutput;
import blitz.engine.model.SystemState;
import blitz.engine.service.process.CommandTemplate;
import blitz.engine.service.process.ProcessRun;
import blitz.engine.service.process.ProcessSupervisor;
import blitz.engine.service.system.PowerService;
import blitz.engine.service.system.ProjectService;
import blitz.engine.service.system.SystemCommandException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Applies update protocol commands: switching an installed system to its new
 * configuration, resetting and rebooting.
 */
@Slf4j
public class SystemCommandProcessor implements SystemClientCommand.Handler {
    private final StateStore<SystemState> store;
    private final EventBus<SystemServerEvent> bus;
    private final ProjectService projectService;
    private final PowerService powerService;
    private final ProcessSupervisor supervisor;
    private final BuildLogService buildLog;
    private final EngineProperties properties;
    private final Executor executor;

    public SystemCommandProcessor(StateStore<SystemState> store,
                                  EventBus<SystemServerEvent> bus,
                                  ProjectService projectService,
                                  PowerService powerService,
                                  ProcessSupervisor supervisor,
                                  BuildLogService buildLog,
                                  EngineProperties properties,
                                  Executor executor) {
        this.store = store;
        this.bus = bus;
        this.projectService = projectService;
        this.powerService = powerService;
        this.supervisor = supervisor;
        this.buildLog = buildLog;
        this.properties = properties;
        this.executor = executor;
    }

    public void handle(SystemClientCommand command) {
        log.debug("Handling command: {}", command);
        try {
            command.accept(this);
        } catch (RuntimeException e) {
            log.error("Error handling command {}", command, e);
            bus.publish(new SystemServerEvent.Error("Command failed: " + e.getMessage()));
        }
    }

    @Override
    public void switchConfig() {
        boolean started = store.computeWithLock(state -> {
            if (!(state instanceof SystemState.Idle || state instanceof SystemState.UpdateFailed)) {
                reject("Cannot switch config in state " + stateName(state));
                return false;
            }
            buildLog.clear();
            transition(new SystemState.Switching());
            return true;
        });
        if (started) {
            executor.execute(() -> {
                try {
                    runSwitch();
                } catch (RuntimeException e) {
                    log.error("Unexpected error during config switch", e);
                    failSwitch("Switch to new config failed: " + e.getMessage());
                }
            });
        }
    }

    @Override
    public void devReset() {
        store.withLock(state -> {
            if (state instanceof SystemState.Switching) {
                reject("Cannot reset while a config switch is running");
                return;
            }
            buildLog.clear();
            transition(SystemState.IDLE);
            log.info("Engine state reset");
        });
    }

    @Override
    public void reboot() {
        boolean allowed = store.computeWithLock(state -> {
            if (state instanceof SystemState.Switching) {
                reject("Cannot reboot while a config switch is running");
                return false;
            }
            return true;
        });
        if (!allowed) {
            return;
        }
        try {
            powerService.reboot();
        } catch (SystemCommandException e) {
            log.error("Reboot failed: {}", e.getMessage());
            bus.publish(new SystemServerEvent.Error("Reboot failed: " + e.getMessage()));
        }
    }

    @Override
    public void unsupported() {
        reject("Command not implemented");
    }

    private void runSwitch() {
        List<String> command = CommandTemplate.render(properties.getUpdate().getSwitchCommand(),
                Map.of("workDir", properties.getWorkDir()));
        ProcessOutput terminal = stream(supervisor.run(command));

        if (terminal instanceof ProcessOutput.Completed completed && completed.isSuccess()) {
            String markError = null;
            try {
                projectService.markChangesApplied();
            } catch (IOException e) {
                log.error("Failed to mark changes as applied", e);
                markError = "Config switched, but marking the changes as applied failed: " + e.getMessage();
            }
            String error = markError;
            store.withLock(state -> {
                if (error != null) {
                    bus.publish(new SystemServerEvent.Error(error));
                }
                transition(SystemState.IDLE);
                log.info("Switched to new config");
            });
        } else if (terminal instanceof ProcessOutput.Completed completed) {
            failSwitch("Switch to new config failed with exit code: " + completed.exitCode());
        } else if (terminal instanceof ProcessOutput.Failed failed) {
            failSwitch(failed.message());
        } else {
            failSwitch("Switch to new config was interrupted");
        }
    }

    private ProcessOutput stream(ProcessRun run) {
        try {
            ProcessOutput output;
            while ((output = run.next()) != null) {
                if (output instanceof ProcessOutput.Stdout stdout) {
                    onUpdateLine(stdout.line());
                } else if (output instanceof ProcessOutput.Stderr stderr) {
                    onUpdateLine("[STDERR] " + stderr.line());
                } else {
                    return output;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}", run.getCommand());
        }
        return null;
    }

    private void onUpdateLine(String line) {
        buildLog.append(line);
        store.withLock(state -> bus.publish(new SystemServerEvent.UpdateLog(line)));
    }

    private void failSwitch(String message) {
        store.withLock(state -> {
            log.error("Config switch failed: {}", message);
            bus.publish(new SystemServerEvent.Error(message));
            transition(new SystemState.UpdateFailed(message));
        });
    }

    private void transition(SystemState next) {
        store.replace(next);
        bus.publish(new SystemServerEvent.StateChanged(next));
        log.debug("System state changed to {}", stateName(next));
    }

    private void reject(String message) {
        log.warn("Rejected command: {}", message);
        bus.publish(new SystemServerEvent.Error(message));
    }

    private static String stateName(SystemState state) {
        return state.getClass().getSimpleName();
    }
}
