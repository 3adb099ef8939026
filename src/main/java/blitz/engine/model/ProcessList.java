package blitz.engine.model;

import java.util.List;

public record ProcessList(List<ProcessInfo> processes) {

    public ProcessList {
        processes = List.copyOf(processes);
    }
}
