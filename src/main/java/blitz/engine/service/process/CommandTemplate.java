package blitz.engine.service.process;

import java.util.List;
import java.util.Map;

/**
 * Expands {@code {name}} placeholders in configured command argument lists.
 */
public final class CommandTemplate {

    private CommandTemplate() {
    }

    public static List<String> render(List<String> template, Map<String, String> values) {
        return template.stream()
                .map(arg -> {
                    String rendered = arg;
                    for (Map.Entry<String, String> entry : values.entrySet()) {
                        rendered = rendered.replace("{" + entry.getKey() + "}", entry.getValue());
                    }
                    return rendered;
                })
                .toList();
    }
}
