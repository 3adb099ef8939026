package blitz.engine.model;

public record InstallStep(StepName name, StepStatus status) {

    public static InstallStep waiting(StepName name) {
        return new InstallStep(name, StepStatus.WAITING);
    }

    public InstallStep withStatus(StepStatus next) {
        return new InstallStep(name, next);
    }
}
