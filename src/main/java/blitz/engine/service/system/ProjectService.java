package blitz.engine.service.system;

import blitz.engine.config.EngineProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and updates the app configuration files of the project in the work directory.
 * Each file holds one JSON object whose fields are option records carrying
 * {@code value}, {@code original} and {@code applied}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {
    static final String BASE_CONFIG = "src/nix_base_config.json";

    /**
     * App display name by the config file that enables it, in display order.
     */
    static final Map<String, String> APP_CONFIGS = createAppConfigs();

    private final EngineProperties properties;
    private final ObjectMapper objectMapper;

    private static Map<String, String> createAppConfigs() {
        Map<String, String> apps = new LinkedHashMap<>();
        apps.put("src/btc/bitcoind.json", "Bitcoin");
        apps.put("src/btc/cln.json", "Core Lightning");
        apps.put("src/btc/lnd.json", "LND");
        apps.put("src/blitz/api.json", "Blitz API");
        apps.put("src/blitz/web.json", "Raspiblitz WebUi");
        return apps;
    }

    public Path getWorkDir() {
        return Paths.get(properties.getWorkDir());
    }

    /**
     * NixOS is always part of an installation; the other apps are listed when their
     * {@code enable} option is true. Missing app files count as disabled.
     */
    public List<String> getEnabledApps() throws IOException {
        List<String> apps = new ArrayList<>();
        apps.add("NixOS");
        for (Map.Entry<String, String> app : APP_CONFIGS.entrySet()) {
            Path file = getWorkDir().resolve(app.getKey());
            if (!Files.exists(file)) {
                log.debug("App config {} not found, treating {} as disabled", file, app.getValue());
                continue;
            }
            JsonNode enable = objectMapper.readTree(file.toFile()).path("enable");
            if (enable.path("value").asBoolean(false)) {
                apps.add(app.getValue());
            }
        }
        return apps;
    }

    /**
     * Marks every option of every existing config file as applied, making the current
     * value the new baseline.
     */
    public void markChangesApplied() throws IOException {
        List<String> files = new ArrayList<>();
        files.add(BASE_CONFIG);
        files.addAll(APP_CONFIGS.keySet());

        for (String relative : files) {
            Path file = getWorkDir().resolve(relative);
            if (!Files.exists(file)) {
                continue;
            }
            JsonNode root = objectMapper.readTree(file.toFile());
            if (!(root instanceof ObjectNode)) {
                throw new IOException("Unexpected content in " + file + ": expected a JSON object");
            }
            int updated = 0;
            var fields = root.fields();
            while (fields.hasNext()) {
                JsonNode option = fields.next().getValue();
                if (option instanceof ObjectNode optionNode && optionNode.has("applied")) {
                    optionNode.put("applied", false);
                    if (optionNode.has("value")) {
                        optionNode.set("original", optionNode.get("value"));
                    }
                    updated++;
                }
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
            log.debug("Marked {} options applied in {}", updated, file);
        }
        log.info("Marked project changes as applied in {}", getWorkDir());
    }
}
