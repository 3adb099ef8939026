package blitz.engine.service.system;

import blitz.engine.config.EngineProperties;
import blitz.engine.model.CheckResult;
import blitz.engine.model.SystemSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether the machine meets the minimum hardware requirements.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SystemCheckService {
    private final SystemInfoService systemInfoService;
    private final EngineProperties properties;

    public CheckResult performSystemCheck() {
        return evaluate(systemInfoService.getSystemSummary());
    }

    public CheckResult evaluate(SystemSummary summary) {
        EngineProperties.Check limits = properties.getCheck();
        List<String> issues = new ArrayList<>();

        if (summary.totalMemory() < limits.getMinMemoryMb()) {
            issues.add(String.format("Insufficient RAM: %d MB found, %d MB required.",
                    summary.totalMemory(), limits.getMinMemoryMb()));
        }
        if (summary.cpus().size() < limits.getMinCpuCores()) {
            issues.add(String.format("Insufficient CPU cores: %d found, %d required.",
                    summary.cpus().size(), limits.getMinCpuCores()));
        }

        log.info("System check finished: compatible={}, issues={}", issues.isEmpty(), issues);
        return new CheckResult(summary, issues.isEmpty(), issues);
    }
}
