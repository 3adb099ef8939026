package blitz.engine.dto;

import blitz.engine.model.SystemState;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(SystemServerEvent.StateChanged.class),
        @JsonSubTypes.Type(SystemServerEvent.UpdateLog.class),
        @JsonSubTypes.Type(SystemServerEvent.Error.class)
})
public sealed interface SystemServerEvent {

    @JsonTypeName("StateChanged")
    record StateChanged(SystemState state) implements SystemServerEvent {
    }

    @JsonTypeName("UpdateLog")
    record UpdateLog(String line) implements SystemServerEvent {
    }

    @JsonTypeName("Error")
    record Error(String message) implements SystemServerEvent {
    }
}
