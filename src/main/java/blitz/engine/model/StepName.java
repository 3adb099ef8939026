package blitz.engine.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * The phases of an installation, in the order the install command runs them.
 * Each phase is recognised by a landmark substring in the command's output.
 */
@Getter
@RequiredArgsConstructor
public enum StepName {
    DEPS("Fetching Dependencies", "unpacking 'github:"),
    BUILD("Building NixOS System", "derivations will be built"),
    DISK("Partitioning & Formatting Disk", "sgdisk"),
    MOUNT("Mounting Filesystems", "mount /dev/disk"),
    COPY("Copying System to Disk", "Copying store paths"),
    BOOTLOADER("Installing Bootloader", "installing the boot loader");

    private final String description;
    private final String landmark;

    public static Optional<StepName> fromLogLine(String line) {
        if (line == null) {
            return Optional.empty();
        }
        for (StepName step : values()) {
            if (line.contains(step.landmark)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    public boolean isAfter(StepName other) {
        return other == null || ordinal() > other.ordinal();
    }
}
