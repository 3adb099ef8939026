package blitz.engine.service.system;

import blitz.engine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PowerService {
    private final CommandExecutor commandExecutor;
    private final EngineProperties properties;

    public void reboot() throws SystemCommandException {
        if (properties.isDemo()) {
            log.info("[DEMO] Reboot requested, not rebooting");
            return;
        }
        log.warn("Rebooting the system");
        commandExecutor.execSimple(properties.getUpdate().getRebootCommand());
    }
}
