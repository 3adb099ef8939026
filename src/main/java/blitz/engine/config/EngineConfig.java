package blitz.engine.config;

import blitz.engine.service.process.LocalProcessSupervisor;
import blitz.engine.service.process.ProcessSupervisor;
import blitz.engine.service.process.SimulatedProcessSupervisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class EngineConfig {

    /**
     * Runs session outbound loops, build supervision and process output readers.
     * All of them block, so the pool is unbounded.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService engineExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("engine-"));
    }

    @Bean
    public ProcessSupervisor processSupervisor(EngineProperties properties, ExecutorService engineExecutor) {
        if (properties.isDemo()) {
            log.warn("Demo mode enabled: builds are simulated and nothing is installed");
            return new SimulatedProcessSupervisor(engineExecutor, properties.getDemoStepDelay());
        }
        return new LocalProcessSupervisor(engineExecutor);
    }
}
