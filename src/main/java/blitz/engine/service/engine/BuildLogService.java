package blitz.engine.service.engine;

import blitz.engine.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * In-memory history of the current build's log lines, bounded to the configured size.
 */
@Slf4j
@Service
public class BuildLogService {
    private final int maxHistory;
    private final Deque<String> history = new ArrayDeque<>();

    @Autowired
    public BuildLogService(EngineProperties properties) {
        this(properties.getLogHistory());
    }

    public BuildLogService(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    public synchronized void append(String line) {
        history.addLast(line);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
    }

    public synchronized List<String> getHistory() {
        return List.copyOf(history);
    }

    public synchronized void clear() {
        log.debug("Clearing {} build log lines", history.size());
        history.clear();
    }
}
