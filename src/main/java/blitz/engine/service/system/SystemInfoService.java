package blitz.engine.service.system;

import blitz.engine.model.CpuInfo;
import blitz.engine.model.ProcessInfo;
import blitz.engine.model.ProcessList;
import blitz.engine.model.SystemSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads hardware and OS facts from /proc and the JVM's management beans.
 */
@Slf4j
@Service
public class SystemInfoService {
    private static final long KB_PER_MB = 1024;
    private static final long BYTES_PER_MB = 1024 * 1024;

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final Path procDir;
    private final Path osReleaseFile;

    public SystemInfoService() {
        this(Paths.get("/proc"), Paths.get("/etc/os-release"));
    }

    SystemInfoService(Path procDir, Path osReleaseFile) {
        this.procDir = procDir;
        this.osReleaseFile = osReleaseFile;
    }

    public SystemSummary getSystemSummary() {
        log.info("Gathering system information");
        Map<String, Long> memInfo = readMemInfo();
        Map<String, String> osRelease = readKeyValueFile(osReleaseFile);

        long totalMemory = memInfo.containsKey("MemTotal")
                ? memInfo.get("MemTotal") / KB_PER_MB
                : mxTotalMemoryMb();
        long availableMemory = memInfo.containsKey("MemAvailable")
                ? memInfo.get("MemAvailable") / KB_PER_MB
                : mxFreeMemoryMb();
        long totalSwap = memInfo.getOrDefault("SwapTotal", 0L) / KB_PER_MB;
        long freeSwap = memInfo.getOrDefault("SwapFree", 0L) / KB_PER_MB;

        SystemSummary summary = SystemSummary.builder()
                .totalMemory(totalMemory)
                .usedMemory(Math.max(0, totalMemory - availableMemory))
                .totalSwap(totalSwap)
                .usedSwap(Math.max(0, totalSwap - freeSwap))
                .osName(osRelease.getOrDefault("NAME", System.getProperty("os.name")))
                .osVersion(osRelease.getOrDefault("VERSION_ID", ""))
                .kernelVersion(System.getProperty("os.version"))
                .hostname(hostname())
                .cpus(readCpus())
                .build();
        log.debug("Complete system information: {}", summary);
        return summary;
    }

    public ProcessList getProcessList() {
        log.info("Gathering process list");
        Instant now = Instant.now();
        List<ProcessInfo> processes = ProcessHandle.allProcesses()
                .map(handle -> toProcessInfo(handle, now))
                .toList();
        return new ProcessList(processes);
    }

    private ProcessInfo toProcessInfo(ProcessHandle handle, Instant now) {
        ProcessHandle.Info info = handle.info();
        String executable = info.command().orElse("");
        String name = executable.isEmpty() ? "" : Paths.get(executable).getFileName().toString();

        List<String> command = new ArrayList<>();
        if (!executable.isEmpty()) {
            command.add(executable);
        }
        info.arguments().ifPresent(args -> command.addAll(Arrays.asList(args)));

        Instant start = info.startInstant().orElse(null);
        return new ProcessInfo(
                handle.pid(),
                name,
                command,
                handle.parent().map(ProcessHandle::pid).orElse(null),
                info.user().orElse(null),
                start == null ? 0 : start.getEpochSecond(),
                start == null ? 0 : Duration.between(start, now).toSeconds());
    }

    List<CpuInfo> readCpus() {
        List<CpuInfo> cpus = new ArrayList<>();
        Path cpuInfo = procDir.resolve("cpuinfo");
        if (Files.isReadable(cpuInfo)) {
            try {
                Map<String, String> block = new HashMap<>();
                for (String line : Files.readAllLines(cpuInfo)) {
                    if (line.isBlank()) {
                        addCpu(block, cpus);
                        block.clear();
                        continue;
                    }
                    int colon = line.indexOf(':');
                    if (colon > 0) {
                        block.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
                    }
                }
                addCpu(block, cpus);
            } catch (IOException e) {
                log.warn("Could not read {}: {}", cpuInfo, e.getMessage());
            }
        }
        if (cpus.isEmpty()) {
            for (int i = 0; i < osBean.getAvailableProcessors(); i++) {
                cpus.add(new CpuInfo("cpu" + i, "", osBean.getArch(), 0));
            }
        }
        return cpus;
    }

    private static void addCpu(Map<String, String> block, List<CpuInfo> cpus) {
        if (!block.containsKey("processor")) {
            return;
        }
        long frequency = 0;
        String mhz = block.get("cpu MHz");
        if (mhz != null) {
            try {
                frequency = Math.round(Double.parseDouble(mhz));
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparsable cpu frequency '{}'", mhz);
            }
        }
        cpus.add(new CpuInfo(
                "cpu" + block.get("processor"),
                block.getOrDefault("vendor_id", ""),
                block.getOrDefault("model name", ""),
                frequency));
    }

    Map<String, Long> readMemInfo() {
        Map<String, Long> values = new HashMap<>();
        Path memInfo = procDir.resolve("meminfo");
        if (!Files.isReadable(memInfo)) {
            return values;
        }
        try {
            for (String line : Files.readAllLines(memInfo)) {
                int colon = line.indexOf(':');
                if (colon <= 0) {
                    continue;
                }
                String[] parts = line.substring(colon + 1).trim().split("\\s+");
                try {
                    values.put(line.substring(0, colon), Long.parseLong(parts[0]));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring meminfo line '{}'", line);
                }
            }
        } catch (IOException e) {
            log.warn("Could not read {}: {}", memInfo, e.getMessage());
        }
        return values;
    }

    private Map<String, String> readKeyValueFile(Path file) {
        Map<String, String> values = new HashMap<>();
        if (!Files.isReadable(file)) {
            return values;
        }
        try {
            for (String line : Files.readAllLines(file)) {
                int eq = line.indexOf('=');
                if (eq > 0) {
                    values.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim().replace("\"", ""));
                }
            }
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
        }
        return values;
    }

    private long mxTotalMemoryMb() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            return sunBean.getTotalMemorySize() / BYTES_PER_MB;
        }
        return 0;
    }

    private long mxFreeMemoryMb() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            return sunBean.getFreeMemorySize() / BYTES_PER_MB;
        }
        return 0;
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            log.warn("Could not resolve hostname: {}", e.getMessage());
            return "";
        }
    }
}
