package blitz.engine.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * State of an installed system applying a new configuration.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(SystemState.Idle.class),
        @JsonSubTypes.Type(SystemState.Switching.class),
        @JsonSubTypes.Type(SystemState.UpdateFailed.class),
        @JsonSubTypes.Type(SystemState.UpdateSucceeded.class)
})
public sealed interface SystemState {

    SystemState IDLE = new Idle();

    @JsonTypeName("Idle")
    record Idle() implements SystemState {
    }

    @JsonTypeName("Switching")
    record Switching() implements SystemState {
    }

    @JsonTypeName("UpdateFailed")
    record UpdateFailed(String message) implements SystemState {
    }

    // Not produced by the engine yet: a successful switch goes straight back to Idle.
    @JsonTypeName("UpdateSucceeded")
    record UpdateSucceeded() implements SystemState {
    }
}
