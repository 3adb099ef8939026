package blitz.engine.config;

public enum EngineMode {
    INSTALL, // Live installer: system check, disk selection, disko-install
    SYSTEM   // Installed system: switch to a new configuration, reboot
}
