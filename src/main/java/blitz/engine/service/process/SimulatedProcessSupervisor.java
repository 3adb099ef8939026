package blitz.engine.service.process;

import blitz.engine.model.ProcessOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Stands in for {@link LocalProcessSupervisor} in demo mode. Nothing is executed;
 * a canned transcript is replayed with a fixed delay between lines and the run
 * always completes with exit code 0.
 */
@Slf4j
@RequiredArgsConstructor
public class SimulatedProcessSupervisor implements ProcessSupervisor {

    static final List<String> INSTALL_TRANSCRIPT = List.of(
            "unpacking 'github:NixOS/nixpkgs' into the Git cache...",
            "these 42 derivations will be built:",
            "building '/nix/store/demo-nixos-system.drv'...",
            "+ sgdisk --zap-all /dev/demo",
            "+ mount /dev/disk/by-partlabel/disk-main-root /mnt",
            "Copying store paths to /mnt...",
            "installing the boot loader...",
            "installation finished!");

    static final List<String> SWITCH_TRANSCRIPT = List.of(
            "Starting step: Deps",
            "Starting step: Build",
            "Starting step: Bootloader",
            "Starting step: PostSwitch");

    private final Executor executor;
    private final Duration stepDelay;

    @Override
    public ProcessRun run(List<String> command) {
        ProcessRun run = new ProcessRun(command);
        List<String> transcript = transcriptFor(command);
        log.info("[DEMO] Simulating: {}", String.join(" ", command));

        executor.execute(() -> {
            try {
                for (String line : transcript) {
                    pause();
                    run.emit(new ProcessOutput.Stdout(line));
                }
                run.terminate(new ProcessOutput.Completed(0));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.terminate(new ProcessOutput.Failed("Simulation interrupted"));
            }
        });
        return run;
    }

    private List<String> transcriptFor(List<String> command) {
        if (command.stream().anyMatch(arg -> arg.contains("disko-install"))) {
            return INSTALL_TRANSCRIPT;
        }
        if (command.contains("apply")) {
            return SWITCH_TRANSCRIPT;
        }
        return List.of("[DEMO] " + String.join(" ", command));
    }

    private void pause() throws InterruptedException {
        if (!stepDelay.isZero() && !stepDelay.isNegative()) {
            Thread.sleep(stepDelay.toMillis());
        }
    }
}
