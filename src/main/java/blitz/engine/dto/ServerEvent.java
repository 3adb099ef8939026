package blitz.engine.dto;

import blitz.engine.model.InstallState;
import blitz.engine.model.InstallStep;
import blitz.engine.model.ProcessList;
import blitz.engine.model.SystemSummary;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Events the install engine pushes to every observer. There is no acknowledgement.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(ServerEvent.StateChanged.class),
        @JsonSubTypes.Type(ServerEvent.SystemSummaryUpdated.class),
        @JsonSubTypes.Type(ServerEvent.ProcessListUpdated.class),
        @JsonSubTypes.Type(ServerEvent.InstallStepUpdate.class),
        @JsonSubTypes.Type(ServerEvent.InstallLog.class),
        @JsonSubTypes.Type(ServerEvent.Error.class)
})
public sealed interface ServerEvent {

    @JsonTypeName("StateChanged")
    record StateChanged(InstallState state) implements ServerEvent {
    }

    @JsonTypeName("SystemSummaryUpdated")
    record SystemSummaryUpdated(SystemSummary summary) implements ServerEvent {
    }

    @JsonTypeName("ProcessListUpdated")
    record ProcessListUpdated(ProcessList processList) implements ServerEvent {
    }

    @JsonTypeName("InstallStepUpdate")
    record InstallStepUpdate(InstallStep step) implements ServerEvent {
    }

    @JsonTypeName("InstallLog")
    record InstallLog(String line) implements ServerEvent {
    }

    @JsonTypeName("Error")
    record Error(String message) implements ServerEvent {
    }
}
