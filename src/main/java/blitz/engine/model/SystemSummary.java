package blitz.engine.model;

import lombok.Builder;

import java.util.List;

/**
 * Hardware and OS facts of the machine. Memory values are in MB.
 */
@Builder
public record SystemSummary(
        long totalMemory,
        long usedMemory,
        long totalSwap,
        long usedSwap,
        String osName,
        String osVersion,
        String kernelVersion,
        String hostname,
        List<CpuInfo> cpus
) {
    public SystemSummary {
        cpus = cpus == null ? List.of() : List.copyOf(cpus);
    }
}
