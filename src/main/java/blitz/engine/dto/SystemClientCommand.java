package blitz.engine.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Commands an observer sends to the system (update) engine.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type",
        defaultImpl = SystemClientCommand.Unsupported.class
)
@JsonSubTypes({
        @JsonSubTypes.Type(SystemClientCommand.SwitchConfig.class),
        @JsonSubTypes.Type(SystemClientCommand.DevReset.class),
        @JsonSubTypes.Type(SystemClientCommand.Reboot.class)
})
public sealed interface SystemClientCommand {

    void accept(Handler handler);

    interface Handler {
        void switchConfig();

        void devReset();

        void reboot();

        void unsupported();
    }

    @JsonTypeName("SwitchConfig")
    record SwitchConfig() implements SystemClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.switchConfig();
        }
    }

    @JsonTypeName("DevReset")
    record DevReset() implements SystemClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.devReset();
        }
    }

    @JsonTypeName("Reboot")
    record Reboot() implements SystemClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.reboot();
        }
    }

    @JsonTypeName("Unsupported")
    record Unsupported() implements SystemClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.unsupported();
        }
    }
}
