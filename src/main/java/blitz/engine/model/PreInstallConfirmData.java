package blitz.engine.model;

import java.util.List;

public record PreInstallConfirmData(List<String> apps, String disk) {

    public PreInstallConfirmData {
        apps = List.copyOf(apps);
    }
}
