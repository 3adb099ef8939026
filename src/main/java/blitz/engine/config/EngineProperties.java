package blitz.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "blitz.engine")
public class EngineProperties {
    private EngineMode mode = EngineMode.INSTALL;

    @NotBlank(message = "blitz.engine.work-dir must be set (NIXBLITZ_WORK_DIR)")
    private String workDir;

    private boolean demo = false;
    private Duration demoStepDelay = Duration.ofMillis(500);

    @Min(1)
    private int eventCapacity = 100;

    @Min(1)
    private int logHistory = 1000;

    /**
     * Upper bound for short helper commands such as lsblk and reboot.
     */
    private Duration commandTimeout = Duration.ofSeconds(30);

    private String webSocketPath = "/ws";

    @Valid
    private Check check = new Check();

    @Valid
    private Install install = new Install();

    @Valid
    private Update update = new Update();

    @Data
    public static class Check {
        private long minMemoryMb = 8192;
        private int minCpuCores = 4;
    }

    @Data
    public static class Install {
        private String nixosConfigName = "nixblitzvm";
        private String defaultDisk = "";

        @NotEmpty
        private List<String> command = new ArrayList<>(List.of(
                "sudo", "disko-install", "--flake", "{flake}", "--disk", "main", "{disk}"));

        private boolean copyConfig = true;
        private String configMountPoint = "/mnt/data/config";

        private List<List<String>> copyCommands = new ArrayList<>(List.of(
                List.of("sudo", "mkdir", "-p", "{mountPoint}"),
                List.of("sudo", "mount", "{partition}", "{mountPoint}"),
                List.of("sudo", "rsync", "-av", "--delete", "{workDir}", "{mountPoint}"),
                List.of("sudo", "chown", "-R", "1000:100", "{mountPoint}")));
    }

    @Data
    public static class Update {
        @NotEmpty
        private List<String> switchCommand = new ArrayList<>(List.of(
                "doas", "nixblitz", "apply", "--work-dir", "{workDir}"));

        @NotEmpty
        private List<String> rebootCommand = new ArrayList<>(List.of("sudo", "systemctl", "reboot"));
    }
}
