package blitz.engine.service.system;

import blitz.engine.model.DiskInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Enumerates the block devices an installation can target.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiskService {
    static final List<String> LSBLK_COMMAND = List.of(
            "lsblk", "--json", "--bytes", "-o", "NAME,PATH,SIZE,TYPE,RM,MOUNTPOINTS");

    /**
     * Mount points that only exist on the machine's running live system.
     */
    static final Set<String> LIVE_SYSTEM_MOUNTS = Set.of("/", "/iso", "/nix/.ro-store");

    private final CommandExecutor commandExecutor;
    private final ObjectMapper objectMapper;

    public List<DiskInfo> getDisks() throws SystemCommandException {
        String output = commandExecutor.execSimple(LSBLK_COMMAND);
        List<DiskInfo> disks = parseLsblk(output);
        log.info("Found {} disks", disks.size());
        return disks;
    }

    public List<DiskInfo> parseLsblk(String json) throws SystemCommandException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SystemCommandException("Unable to parse lsblk output: " + e.getOriginalMessage(), e);
        }

        List<DiskInfo> disks = new ArrayList<>();
        for (JsonNode device : root.path("blockdevices")) {
            if (!"disk".equals(device.path("type").asText())) {
                continue;
            }
            String name = device.path("name").asText();
            String path = device.hasNonNull("path") ? device.get("path").asText() : "/dev/" + name;

            List<String> mountPoints = new ArrayList<>();
            collectMountPoints(device, mountPoints);
            boolean liveSystem = mountPoints.stream().anyMatch(LIVE_SYSTEM_MOUNTS::contains);

            disks.add(new DiskInfo(name, path, device.path("size").asLong(), mountPoints,
                    parseFlag(device.path("rm")), liveSystem));
        }
        return disks;
    }

    private static void collectMountPoints(JsonNode device, List<String> into) {
        addMount(device.get("mountpoint"), into);
        for (JsonNode mount : device.path("mountpoints")) {
            addMount(mount, into);
        }
        for (JsonNode child : device.path("children")) {
            collectMountPoints(child, into);
        }
    }

    private static void addMount(JsonNode mount, List<String> into) {
        if (mount != null && mount.isTextual() && !mount.asText().isEmpty()) {
            into.add(mount.asText());
        }
    }

    // lsblk prints RM as a boolean in newer and as "0"/"1" in older releases
    private static boolean parseFlag(JsonNode node) {
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return "1".equals(node.asText());
    }
}
