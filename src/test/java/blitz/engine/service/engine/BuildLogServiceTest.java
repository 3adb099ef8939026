package blitz.engine.service.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuildLogServiceTest {

    @Test
    void append_keepsOnlyNewestLines() {
        BuildLogService buildLog = new BuildLogService(3);

        for (int i = 1; i <= 5; i++) {
            buildLog.append("line " + i);
        }

        assertEquals(List.of("line 3", "line 4", "line 5"), buildLog.getHistory());
    }

    @Test
    void clear_dropsHistory() {
        BuildLogService buildLog = new BuildLogService(10);
        buildLog.append("line");

        buildLog.clear();

        assertTrue(buildLog.getHistory().isEmpty());
    }
}
