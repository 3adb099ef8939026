package blitz.engine.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Commands an observer sends to the install engine. A frame whose type is not
 * one of the known commands decodes to {@link Unsupported}.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type",
        defaultImpl = ClientCommand.Unsupported.class
)
@JsonSubTypes({
        @JsonSubTypes.Type(ClientCommand.PerformSystemCheck.class),
        @JsonSubTypes.Type(ClientCommand.GetSystemSummary.class),
        @JsonSubTypes.Type(ClientCommand.GetProcessList.class),
        @JsonSubTypes.Type(ClientCommand.UpdateConfig.class),
        @JsonSubTypes.Type(ClientCommand.UpdateConfigFinished.class),
        @JsonSubTypes.Type(ClientCommand.InstallDiskSelected.class),
        @JsonSubTypes.Type(ClientCommand.StartInstallation.class),
        @JsonSubTypes.Type(ClientCommand.DevReset.class)
})
public sealed interface ClientCommand {

    void accept(Handler handler);

    interface Handler {
        void performSystemCheck();

        void getSystemSummary();

        void getProcessList();

        void updateConfig();

        void updateConfigFinished();

        void installDiskSelected(String path);

        void startInstallation();

        void devReset();

        void unsupported();
    }

    @JsonTypeName("PerformSystemCheck")
    record PerformSystemCheck() implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.performSystemCheck();
        }
    }

    @JsonTypeName("GetSystemSummary")
    record GetSystemSummary() implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.getSystemSummary();
        }
    }

    @JsonTypeName("GetProcessList")
    record GetProcessList() implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.getProcessList();
        }
    }

    @JsonTypeName("UpdateConfig")
    record UpdateConfig() implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.updateConfig();
        }
    }

    @JsonTypeName("UpdateConfigFinished")
    record UpdateConfigFinished() implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.updateConfigFinished();
        }
    }

    @JsonTypeName("InstallDiskSelected")
    record InstallDiskSelected(String path) implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.installDiskSelected(path);
        }
    }

    @JsonTypeName("StartInstallation")
    record StartInstallation() implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.startInstallation();
        }
    }

    @JsonTypeName("DevReset")
    record DevReset() implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.devReset();
        }
    }

    @JsonTypeName("Unsupported")
    record Unsupported() implements ClientCommand {
        @Override
        public void accept(Handler handler) {
            handler.unsupported();
        }
    }
}
