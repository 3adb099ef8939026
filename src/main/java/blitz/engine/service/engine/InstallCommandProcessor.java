package blitz.engine.service.engine;

import blitz.engine.config.EngineProperties;
import blitz.engine.dto.ClientCommand;
import blitz.engine.dto.ServerEvent;
import blitz.engine.model.CheckResult;
import blitz.engine.model.DiskInfo;
import blitz.engine.model.InstallState;
import blitz.engine.model.InstallStep;
import blitz.engine.model.PreInstallConfirmData;
import blitz.engine.model.ProcessList;
import blitz.engine.model.ProcessOutput;
import blitz.engine.model.StepName;
import blitz.engine.model.SystemSummary;
import blitz.engine.service.process.CommandTemplate;
import blitz.engine.service.process.ProcessRun;
import blitz.engine.service.process.ProcessSupervisor;
import blitz.engine.service.system.DiskService;
import blitz.engine.service.system.ProjectService;
import blitz.engine.service.system.SystemCheckService;
import blitz.engine.service.system.SystemCommandException;
import blitz.engine.service.system.SystemInfoService;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Applies install protocol commands to the install state.
 * <p>
 * Every transition is stored and published while holding the state lock, so
 * observers see state changes in the order they happened. Collaborators are
 * always called with the lock released; their results are only applied if the
 * state has not moved on in the meantime.
 */
@Slf4j
public class InstallCommandProcessor implements ClientCommand.Handler {
    private final StateStore<InstallState> store;
    private final EventBus<ServerEvent> bus;
    private final SystemInfoService systemInfoService;
    private final SystemCheckService systemCheckService;
    private final DiskService diskService;
    private final ProjectService projectService;
    private final ProcessSupervisor supervisor;
    private final BuildLogService buildLog;
    private final EngineProperties properties;
    private final Executor executor;

    // guarded by the state lock
    private StepTracker tracker = new StepTracker();
    private List<DiskInfo> knownDisks = List.of();
    private CheckResult lastCheck;

    public InstallCommandProcessor(StateStore<InstallState> store,
                                   EventBus<ServerEvent> bus,
                                   SystemInfoService systemInfoService,
                                   SystemCheckService systemCheckService,
                                   DiskService diskService,
                                   ProjectService projectService,
                                   ProcessSupervisor supervisor,
                                   BuildLogService buildLog,
                                   EngineProperties properties,
                                   Executor executor) {
        this.store = store;
        this.bus = bus;
        this.systemInfoService = systemInfoService;
        this.systemCheckService = systemCheckService;
        this.diskService = diskService;
        this.projectService = projectService;
        this.supervisor = supervisor;
        this.buildLog = buildLog;
        this.properties = properties;
        this.executor = executor;
    }

    public void handle(ClientCommand command) {
        log.debug("Handling command: {}", command);
        try {
            command.accept(this);
        } catch (RuntimeException e) {
            log.error("Error handling command {}", command, e);
            bus.publish(new ServerEvent.Error("Command failed: " + e.getMessage()));
        }
    }

    @Override
    public void performSystemCheck() {
        InstallState.PerformingCheck checking = new InstallState.PerformingCheck();
        InstallState previous = store.computeWithLock(state -> {
            if (state instanceof InstallState.PerformingCheck || state instanceof InstallState.Installing) {
                reject("Cannot perform a system check while in state " + stateName(state));
                return null;
            }
            transition(checking);
            return state;
        });
        if (previous == null) {
            return;
        }

        CheckResult result;
        try {
            result = systemCheckService.performSystemCheck();
        } catch (RuntimeException e) {
            log.error("System check failed", e);
            store.withLock(state -> {
                bus.publish(new ServerEvent.Error("System check failed: " + e.getMessage()));
                if (state == checking) {
                    transition(previous);
                }
            });
            return;
        }

        store.withLock(state -> {
            if (state != checking) {
                log.info("Discarding system check result, state moved on to {}", stateName(state));
                return;
            }
            lastCheck = result;
            transition(new InstallState.SystemCheckCompleted(result));
            log.info("System check completed");
        });
    }

    @Override
    public void getSystemSummary() {
        SystemSummary summary;
        try {
            summary = systemInfoService.getSystemSummary();
        } catch (RuntimeException e) {
            log.error("Failed to gather system summary", e);
            bus.publish(new ServerEvent.Error("Failed to gather system summary: " + e.getMessage()));
            return;
        }
        bus.publish(new ServerEvent.SystemSummaryUpdated(summary));
    }

    @Override
    public void getProcessList() {
        ProcessList processList;
        try {
            processList = systemInfoService.getProcessList();
        } catch (RuntimeException e) {
            log.error("Failed to gather process list", e);
            bus.publish(new ServerEvent.Error("Failed to gather process list: " + e.getMessage()));
            return;
        }
        bus.publish(new ServerEvent.ProcessListUpdated(processList));
    }

    @Override
    public void updateConfig() {
        store.withLock(state -> {
            boolean allowed = (state instanceof InstallState.SystemCheckCompleted completed
                    && completed.result().compatible())
                    || state instanceof InstallState.SelectInstallDisk
                    || state instanceof InstallState.SelectDiskError
                    || state instanceof InstallState.PreInstallConfirm;
            if (!allowed) {
                reject("Cannot update the configuration in state " + stateName(state));
                return;
            }
            transition(new InstallState.UpdateConfig());
        });
    }

    @Override
    public void updateConfigFinished() {
        InstallState origin = store.computeWithLock(state -> {
            if (!(state instanceof InstallState.UpdateConfig)) {
                reject("Configuration update is not in progress");
                return null;
            }
            return state;
        });
        if (origin == null) {
            return;
        }

        List<DiskInfo> disks;
        try {
            disks = diskService.getDisks();
        } catch (SystemCommandException e) {
            log.error("Failed to get disk info: {}", e.getMessage());
            bus.publish(new ServerEvent.Error("Failed to get disk info: " + e.getMessage()));
            return;
        }

        store.withLock(state -> {
            if (state != origin) {
                log.info("Discarding disk list, state moved on to {}", stateName(state));
                return;
            }
            knownDisks = List.copyOf(disks);
            transition(new InstallState.SelectInstallDisk(disks));
        });
    }

    @Override
    public void installDiskSelected(String path) {
        InstallState origin = store.computeWithLock(state -> {
            if (!(state instanceof InstallState.SelectInstallDisk || state instanceof InstallState.SelectDiskError)) {
                reject("Cannot select an install disk in state " + stateName(state));
                return null;
            }
            Optional<DiskInfo> disk = knownDisks.stream().filter(d -> d.path().equals(path)).findFirst();
            if (disk.isEmpty()) {
                transition(new InstallState.SelectDiskError("Disk not found: " + path));
                return null;
            }
            if (disk.get().liveSystem()) {
                transition(new InstallState.SelectDiskError(
                        "Cannot install on " + path + ", it holds the running live system"));
                return null;
            }
            return state;
        });
        if (origin == null) {
            return;
        }

        List<String> apps;
        try {
            apps = projectService.getEnabledApps();
        } catch (IOException e) {
            log.error("Failed to read the project configuration", e);
            bus.publish(new ServerEvent.Error("Failed to read the project configuration: " + e.getMessage()));
            return;
        }

        store.withLock(state -> {
            if (state != origin) {
                log.info("Discarding disk selection, state moved on to {}", stateName(state));
                return;
            }
            transition(new InstallState.PreInstallConfirm(new PreInstallConfirmData(apps, path)));
        });
    }

    @Override
    public void startInstallation() {
        String disk = store.computeWithLock(state -> {
            String target;
            if (state instanceof InstallState.SystemCheckCompleted completed) {
                if (!completed.result().compatible()) {
                    reject("Cannot install on an incompatible system.");
                    return null;
                }
                target = properties.getInstall().getDefaultDisk();
                if (target == null || target.isBlank()) {
                    reject("No install disk selected. Update the configuration and select a disk first.");
                    return null;
                }
            } else if (state instanceof InstallState.PreInstallConfirm confirm) {
                if (lastCheck == null || !lastCheck.compatible()) {
                    reject("Cannot install on an incompatible system.");
                    return null;
                }
                target = confirm.data().disk();
            } else {
                reject("System check must be performed before installation.");
                return null;
            }

            tracker = new StepTracker();
            buildLog.clear();
            transition(new InstallState.Installing(tracker.steps()));
            return target;
        });
        if (disk == null) {
            return;
        }

        log.info("Starting installation on {}", disk);
        executor.execute(() -> {
            try {
                runInstallation(disk);
            } catch (RuntimeException e) {
                log.error("Unexpected error during installation", e);
                failInstallation("Installation failed: " + e.getMessage());
            }
        });
    }

    @Override
    public void devReset() {
        store.withLock(state -> {
            if (state instanceof InstallState.Installing) {
                reject("Cannot reset while an installation is running");
                return;
            }
            tracker = new StepTracker();
            knownDisks = List.of();
            lastCheck = null;
            buildLog.clear();
            transition(InstallState.IDLE);
            log.info("Engine state reset");
        });
    }

    @Override
    public void unsupported() {
        reject("Command not implemented");
    }

    private void runInstallation(String disk) {
        EngineProperties.Install install = properties.getInstall();
        List<String> command = CommandTemplate.render(install.getCommand(), Map.of(
                "flake", properties.getWorkDir() + "/src#" + install.getNixosConfigName(),
                "disk", disk,
                "workDir", properties.getWorkDir()));

        ProcessOutput terminal = stream(supervisor.run(command), true);
        if (terminal instanceof ProcessOutput.Completed completed && completed.isSuccess()) {
            if (install.isCopyConfig()) {
                String failure = copyConfig(disk);
                if (failure != null) {
                    failInstallation(failure);
                    return;
                }
            }
            succeedInstallation();
        } else if (terminal instanceof ProcessOutput.Completed completed) {
            String message = "Installation failed with exit code: " + completed.exitCode();
            failInstallation(message);
        } else if (terminal instanceof ProcessOutput.Failed failed) {
            failInstallation(failed.message());
        } else {
            failInstallation("Installation was interrupted");
        }
    }

    /**
     * Runs the configured copy commands.
     *
     * @return a failure message, or {@code null} when all commands succeeded
     */
    private String copyConfig(String disk) {
        EngineProperties.Install install = properties.getInstall();
        Map<String, String> values = Map.of(
                "partition", dataPartition(disk),
                "mountPoint", install.getConfigMountPoint(),
                "workDir", properties.getWorkDir(),
                "disk", disk);

        for (List<String> template : install.getCopyCommands()) {
            List<String> command = CommandTemplate.render(template, values);
            ProcessOutput terminal = stream(supervisor.run(command), false);
            if (terminal instanceof ProcessOutput.Completed completed && completed.isSuccess()) {
                continue;
            }
            if (terminal instanceof ProcessOutput.Completed completed) {
                return "Copying the configuration failed: '" + String.join(" ", command)
                        + "' exited with code: " + completed.exitCode();
            }
            if (terminal instanceof ProcessOutput.Failed failed) {
                return "Copying the configuration failed: " + failed.message();
            }
            return "Copying the configuration was interrupted";
        }
        return null;
    }

    static String dataPartition(String disk) {
        return disk.contains("nvme") ? disk + "p3" : disk + "3";
    }

    /**
     * Forwards every line of {@code run} as a log event.
     *
     * @return the terminal element, or {@code null} if interrupted
     */
    private ProcessOutput stream(ProcessRun run, boolean trackSteps) {
        try {
            ProcessOutput output;
            while ((output = run.next()) != null) {
                if (output instanceof ProcessOutput.Stdout stdout) {
                    onInstallLine(stdout.line(), stdout.line(), trackSteps);
                } else if (output instanceof ProcessOutput.Stderr stderr) {
                    onInstallLine("[STDERR] " + stderr.line(), stderr.line(), trackSteps);
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

    private void onInstallLine(String logLine, String rawLine, boolean trackSteps) {
        buildLog.append(logLine);
        store.withLock(state -> {
            bus.publish(new ServerEvent.InstallLog(logLine));
            if (!trackSteps || !(state instanceof InstallState.Installing)) {
                return;
            }
            Optional<StepName> step = StepName.fromLogLine(rawLine);
            if (step.isPresent()) {
                List<InstallStep> changed = tracker.advanceTo(step.get());
                if (!changed.isEmpty()) {
                    log.info("Installation step started: {}", step.get().getDescription());
                    publishSteps(changed);
                    store.replace(new InstallState.Installing(tracker.steps()));
                }
            }
        });
    }

    private void succeedInstallation() {
        store.withLock(state -> {
            publishSteps(tracker.completeAll());
            transition(new InstallState.InstallSucceeded(tracker.steps()));
            log.info("Installation completed successfully");
        });
    }

    private void failInstallation(String reason) {
        store.withLock(state -> {
            log.error("Installation failed: {}", reason);
            publishSteps(tracker.fail(reason));
            bus.publish(new ServerEvent.Error(reason));
            transition(new InstallState.InstallFailed(reason));
        });
    }

    private void publishSteps(List<InstallStep> steps) {
        for (InstallStep step : steps) {
            bus.publish(new ServerEvent.InstallStepUpdate(step));
        }
    }

    private void transition(InstallState next) {
        store.replace(next);
        bus.publish(new ServerEvent.StateChanged(next));
        log.debug("Install state changed to {}", stateName(next));
    }

    private void reject(String message) {
        log.warn("Rejected command: {}", message);
        bus.publish(new ServerEvent.Error(message));
    }

    private static String stateName(InstallState state) {
        return state.getClass().getSimpleName();
    }
}
