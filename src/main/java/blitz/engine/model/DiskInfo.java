package blitz.engine.model;

import java.util.List;

public record DiskInfo(
        String name,
        String path,
        long sizeBytes,
        List<String> mountPoints,
        boolean removable,
        boolean liveSystem
) {
    public DiskInfo {
        mountPoints = mountPoints == null ? List.of() : List.copyOf(mountPoints);
    }
}
