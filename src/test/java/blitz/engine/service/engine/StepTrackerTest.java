package blitz.engine.service.engine;

import blitz.engine.model.InstallStep;
import blitz.engine.model.StepName;
import blitz.engine.model.StepStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StepTrackerTest {

    private StepTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new StepTracker();
    }

    @Test
    void newTracker_hasAllStepsWaitingInOrder() {
        List<InstallStep> steps = tracker.steps();

        assertEquals(StepName.values().length, steps.size());
        for (int i = 0; i < steps.size(); i++) {
            assertEquals(StepName.values()[i], steps.get(i).name());
            assertEquals(StepStatus.WAITING, steps.get(i).status());
        }
        assertNull(tracker.getCurrent());
    }

    @Test
    void advanceTo_firstStepPutsItInProgress() {
        List<InstallStep> changed = tracker.advanceTo(StepName.DEPS);

        assertEquals(List.of(new InstallStep(StepName.DEPS, StepStatus.IN_PROGRESS)), changed);
        assertEquals(StepName.DEPS, tracker.getCurrent());
    }

    @Test
    void advanceTo_walksSkippedStepsThroughEveryStatus() {
        tracker.advanceTo(StepName.DEPS);

        List<InstallStep> changed = tracker.advanceTo(StepName.DISK);

        assertEquals(List.of(
                new InstallStep(StepName.DEPS, StepStatus.DONE),
                new InstallStep(StepName.BUILD, StepStatus.IN_PROGRESS),
                new InstallStep(StepName.BUILD, StepStatus.DONE),
                new InstallStep(StepName.DISK, StepStatus.IN_PROGRESS)
        ), changed);
        assertEquals(StepName.DISK, tracker.getCurrent());
    }

    @Test
    void advanceTo_ignoresCurrentAndEarlierSteps() {
        tracker.advanceTo(StepName.MOUNT);

        assertTrue(tracker.advanceTo(StepName.MOUNT).isEmpty());
        assertTrue(tracker.advanceTo(StepName.BUILD).isEmpty());
        assertEquals(StepName.MOUNT, tracker.getCurrent());
    }

    @Test
    void completeAll_finishesRemainingSteps() {
        tracker.advanceTo(StepName.DISK);

        List<InstallStep> changed = tracker.completeAll();

        assertEquals(new InstallStep(StepName.DISK, StepStatus.DONE), changed.get(0));
        assertEquals(7, changed.size());
        assertTrue(tracker.steps().stream().allMatch(step -> step.status().equals(StepStatus.DONE)));
    }

    @Test
    void fail_marksCurrentStepFailed() {
        tracker.advanceTo(StepName.BUILD);

        List<InstallStep> changed = tracker.fail("boom");

        assertEquals(List.of(new InstallStep(StepName.BUILD, new StepStatus.Failed("boom"))), changed);
        assertTrue(tracker.fail("again").isEmpty());
    }

    @Test
    void fail_beforeStart_failsFirstStep() {
        List<InstallStep> changed = tracker.fail("could not spawn");

        assertEquals(List.of(
                new InstallStep(StepName.DEPS, StepStatus.IN_PROGRESS),
                new InstallStep(StepName.DEPS, new StepStatus.Failed("could not spawn"))
        ), changed);
    }

    @Test
    void landmarkSequence_onlyProducesValidTransitions() {
        List<String> log = List.of(
                "unpacking 'github:NixOS/nixpkgs'",
                "these 12 derivations will be built:",
                "+ mount /dev/disk/by-partlabel/root /mnt",
                "+ sgdisk --zap-all /dev/sda",
                "Copying store paths",
                "installing the boot loader...");

        List<InstallStep> changes = new ArrayList<>();
        for (String line : log) {
            StepName.fromLogLine(line).ifPresent(step -> changes.addAll(tracker.advanceTo(step)));
        }
        changes.addAll(tracker.completeAll());

        Map<StepName, StepStatus> last = new EnumMap<>(StepName.class);
        for (InstallStep change : changes) {
            StepStatus previous = last.getOrDefault(change.name(), StepStatus.WAITING);
            assertTrue(StepStatus.isValidTransition(previous, change.status()),
                    change.name() + ": " + previous + " -> " + change.status());
            last.put(change.name(), change.status());
        }
        assertEquals(StepName.values().length, last.size());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "unpacking 'github:raspiblitz/nixblitz' into the Git cache...|DEPS",
            "these 42 derivations will be built:|BUILD",
            "+ sgdisk --zap-all /dev/vda|DISK",
            "+ mount /dev/disk/by-partlabel/disk-main-root /mnt|MOUNT",
            "Copying store paths to /mnt|COPY",
            "installing the boot loader...|BOOTLOADER"
    })
    void fromLogLine_detectsLandmarks(String line, StepName expected) {
        assertEquals(expected, StepName.fromLogLine(line).orElseThrow());
    }

    @Test
    void fromLogLine_ignoresOtherLines() {
        assertTrue(StepName.fromLogLine("copying path '/nix/store/abc'").isEmpty());
        assertTrue(StepName.fromLogLine(null).isEmpty());
    }

    @Test
    void stepStatus_terminalStatesNeverMove() {
        assertFalse(StepStatus.isValidTransition(StepStatus.DONE, StepStatus.IN_PROGRESS));
        assertFalse(StepStatus.isValidTransition(new StepStatus.Failed("x"), StepStatus.DONE));
        assertFalse(StepStatus.isValidTransition(StepStatus.WAITING, StepStatus.DONE));
        assertTrue(StepStatus.isValidTransition(StepStatus.IN_PROGRESS, new StepStatus.Failed("x")));
    }
}
