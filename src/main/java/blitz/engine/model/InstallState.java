package blitz.engine.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * State of the installation, visible to all observers. Values are immutable and
 * replaced as a whole on every transition.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(InstallState.Idle.class),
        @JsonSubTypes.Type(InstallState.PerformingCheck.class),
        @JsonSubTypes.Type(InstallState.SystemCheckCompleted.class),
        @JsonSubTypes.Type(InstallState.UpdateConfig.class),
        @JsonSubTypes.Type(InstallState.SelectInstallDisk.class),
        @JsonSubTypes.Type(InstallState.SelectDiskError.class),
        @JsonSubTypes.Type(InstallState.PreInstallConfirm.class),
        @JsonSubTypes.Type(InstallState.Installing.class),
        @JsonSubTypes.Type(InstallState.InstallFailed.class),
        @JsonSubTypes.Type(InstallState.InstallSucceeded.class)
})
public sealed interface InstallState {

    InstallState IDLE = new Idle();

    @JsonTypeName("Idle")
    record Idle() implements InstallState {
    }

    @JsonTypeName("PerformingCheck")
    record PerformingCheck() implements InstallState {
    }

    @JsonTypeName("SystemCheckCompleted")
    record SystemCheckCompleted(CheckResult result) implements InstallState {
    }

    @JsonTypeName("UpdateConfig")
    record UpdateConfig() implements InstallState {
    }

    @JsonTypeName("SelectInstallDisk")
    record SelectInstallDisk(List<DiskInfo> disks) implements InstallState {
        public SelectInstallDisk {
            disks = List.copyOf(disks);
        }
    }

    @JsonTypeName("SelectDiskError")
    record SelectDiskError(String message) implements InstallState {
    }

    @JsonTypeName("PreInstallConfirm")
    record PreInstallConfirm(PreInstallConfirmData data) implements InstallState {
    }

    @JsonTypeName("Installing")
    record Installing(List<InstallStep> steps) implements InstallState {
        public Installing {
            steps = List.copyOf(steps);
        }
    }

    @JsonTypeName("InstallFailed")
    record InstallFailed(String message) implements InstallState {
    }

    @JsonTypeName("InstallSucceeded")
    record InstallSucceeded(List<InstallStep> steps) implements InstallState {
        public InstallSucceeded {
            steps = List.copyOf(steps);
        }
    }
}
