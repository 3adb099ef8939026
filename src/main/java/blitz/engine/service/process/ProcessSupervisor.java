package blitz.engine.service.process;

import java.util.List;

/**
 * Launches external commands and exposes their output as a {@link ProcessRun}.
 */
public interface ProcessSupervisor {

    /**
     * Starts {@code command} without a shell. Never throws for spawn failures;
     * those surface as a terminal {@link blitz.engine.model.ProcessOutput.Failed}.
     */
    ProcessRun run(List<String> command);
}
