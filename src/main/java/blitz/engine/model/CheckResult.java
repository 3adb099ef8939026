package blitz.engine.model;

import java.util.List;

public record CheckResult(SystemSummary summary, boolean compatible, List<String> issues) {

    public CheckResult {
        issues = List.copyOf(issues);
    }
}
