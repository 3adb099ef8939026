package blitz.engine.service.engine;

import blitz.engine.model.InstallStep;
import blitz.engine.model.StepName;
import blitz.engine.model.StepStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks the steps of one installation. Every method returns the step snapshots
 * that changed, in the order they changed, so each can be published on its own.
 * <p>
 * Not thread-safe; callers hold the state lock.
 */
public class StepTracker {
    private final Map<StepName, StepStatus> statuses = new EnumMap<>(StepName.class);
    private StepName current;

    public StepTracker() {
        for (StepName name : StepName.values()) {
            statuses.put(name, StepStatus.WAITING);
        }
    }

    public List<InstallStep> steps() {
        List<InstallStep> steps = new ArrayList<>(statuses.size());
        statuses.forEach((name, status) -> steps.add(new InstallStep(name, status)));
        return List.copyOf(steps);
    }

    public StepName getCurrent() {
        return current;
    }

    /**
     * Moves progress forward to {@code target}. Steps between the current one and
     * the target pass through InProgress to Done. Targets at or before the current
     * step are ignored.
     */
    public List<InstallStep> advanceTo(StepName target) {
        List<InstallStep> changed = new ArrayList<>();
        if (!target.isAfter(current)) {
            return changed;
        }
        for (StepName name : StepName.values()) {
            if (name.compareTo(target) > 0) {
                break;
            }
            if (name == target) {
                moveTo(name, StepStatus.IN_PROGRESS, changed);
            } else {
                finish(name, changed);
            }
        }
        current = target;
        return changed;
    }

    public List<InstallStep> completeAll() {
        List<InstallStep> changed = new ArrayList<>();
        for (StepName name : StepName.values()) {
            finish(name, changed);
        }
        current = StepName.values()[StepName.values().length - 1];
        return changed;
    }

    /**
     * Fails the step in progress, or the first step if none was started.
     */
    public List<InstallStep> fail(String reason) {
        List<InstallStep> changed = new ArrayList<>();
        if (current == null) {
            current = StepName.values()[0];
        }
        if (StepStatus.isTerminal(statuses.get(current))) {
            return changed;
        }
        if (statuses.get(current) instanceof StepStatus.Waiting) {
            moveTo(current, StepStatus.IN_PROGRESS, changed);
        }
        moveTo(current, new StepStatus.Failed(reason), changed);
        return changed;
    }

    private void finish(StepName name, List<InstallStep> changed) {
        StepStatus status = statuses.get(name);
        if (status instanceof StepStatus.Waiting) {
            moveTo(name, StepStatus.IN_PROGRESS, changed);
            status = StepStatus.IN_PROGRESS;
        }
        if (status instanceof StepStatus.InProgress) {
            moveTo(name, StepStatus.DONE, changed);
        }
    }

    private void moveTo(StepName name, StepStatus next, List<InstallStep> changed) {
        StepStatus previous = statuses.get(name);
        if (!StepStatus.isValidTransition(previous, next)) {
            throw new IllegalStateException("Step " + name + " cannot move from " + previous + " to " + next);
        }
        statuses.put(name, next);
        changed.add(new InstallStep(name, next));
    }
}
