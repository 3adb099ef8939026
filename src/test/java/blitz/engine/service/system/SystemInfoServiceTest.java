package blitz.engine.service.system;

import blitz.engine.model.CpuInfo;
import blitz.engine.model.ProcessList;
import blitz.engine.model.SystemSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SystemInfoServiceTest {

    @TempDir
    Path root;

    private SystemInfoService service;

    @BeforeEach
    void setUp() throws IOException {
        Path proc = Files.createDirectories(root.resolve("proc"));
        Files.writeString(proc.resolve("meminfo"), """
                MemTotal:       16384000 kB
                MemFree:         1024000 kB
                MemAvailable:   12288000 kB
                SwapTotal:       2048000 kB
                SwapFree:        1024000 kB
                """);
        Files.writeString(proc.resolve("cpuinfo"), """
                processor\t: 0
                vendor_id\t: GenuineIntel
                model name\t: Intel(R) Core(TM) i7-8550U CPU @ 1.80GHz
                cpu MHz\t\t: 1992.002

                processor\t: 1
                vendor_id\t: GenuineIntel
                model name\t: Intel(R) Core(TM) i7-8550U CPU @ 1.80GHz
                cpu MHz\t\t: 2100.500
                """);
        Path osRelease = root.resolve("os-release");
        Files.writeString(osRelease, """
                NAME=NixOS
                VERSION_ID="24.11"
                """);
        service = new SystemInfoService(proc, osRelease);
    }

    @Test
    void getSystemSummary_readsMemoryInMegabytes() {
        SystemSummary summary = service.getSystemSummary();

        assertEquals(16000, summary.totalMemory());
        assertEquals(4000, summary.usedMemory());
        assertEquals(2000, summary.totalSwap());
        assertEquals(1000, summary.usedSwap());
        assertEquals("NixOS", summary.osName());
        assertEquals("24.11", summary.osVersion());
    }

    @Test
    void readCpus_parsesEveryProcessor() {
        List<CpuInfo> cpus = service.readCpus();

        assertEquals(List.of(
                new CpuInfo("cpu0", "GenuineIntel", "Intel(R) Core(TM) i7-8550U CPU @ 1.80GHz", 1992),
                new CpuInfo("cpu1", "GenuineIntel", "Intel(R) Core(TM) i7-8550U CPU @ 1.80GHz", 2101)
        ), cpus);
    }

    @Test
    void getProcessList_includesThisProcess() {
        ProcessList processes = service.getProcessList();

        long self = ProcessHandle.current().pid();
        assertTrue(processes.processes().stream().anyMatch(process -> process.pid() == self));
    }
}
