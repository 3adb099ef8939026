package blitz.engine.model;

import java.util.List;

/**
 * A process running on the machine. {@code startTime} is seconds since the epoch,
 * {@code runTime} is seconds.
 */
public record ProcessInfo(
        long pid,
        String name,
        List<String> command,
        Long parentPid,
        String user,
        long startTime,
        long runTime
) {
    public ProcessInfo {
        command = command == null ? List.of() : List.copyOf(command);
    }
}
