package blitz.engine.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(StepStatus.Waiting.class),
        @JsonSubTypes.Type(StepStatus.InProgress.class),
        @JsonSubTypes.Type(StepStatus.Done.class),
        @JsonSubTypes.Type(StepStatus.Failed.class)
})
public sealed interface StepStatus {

    StepStatus WAITING = new Waiting();
    StepStatus IN_PROGRESS = new InProgress();
    StepStatus DONE = new Done();

    @JsonTypeName("Waiting")
    record Waiting() implements StepStatus {
    }

    @JsonTypeName("InProgress")
    record InProgress() implements StepStatus {
    }

    @JsonTypeName("Done")
    record Done() implements StepStatus {
    }

    @JsonTypeName("Failed")
    record Failed(String reason) implements StepStatus {
    }

    /**
     * A step only ever moves Waiting -> InProgress -> Done | Failed.
     */
    static boolean isValidTransition(StepStatus from, StepStatus to) {
        if (from instanceof Waiting) {
            return to instanceof InProgress;
        }
        if (from instanceof InProgress) {
            return to instanceof Done || to instanceof Failed;
        }
        return false;
    }

    static boolean isTerminal(StepStatus status) {
        return status instanceof Done || status instanceof Failed;
    }
}
