package blitz.engine.service.process;

import blitz.engine.model.ProcessOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs commands on the local machine. Stdin is closed right after spawning and
 * both output streams are pumped line by line on the given executor.
 */
@Slf4j
@RequiredArgsConstructor
public class LocalProcessSupervisor implements ProcessSupervisor {
    private final Executor executor;

    @Override
    public ProcessRun run(List<String> command) {
        ProcessRun run = new ProcessRun(command);
        String commandLine = String.join(" ", command);
        log.info("Executing: {}", commandLine);

        Process process;
        try {
            process = start(command);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to spawn command '{}': {}", commandLine, e.getMessage());
            run.terminate(spawnFailure(commandLine, e));
            return run;
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.error("Failed to close stdin of '{}': {}", commandLine, e.getMessage());
            process.destroyForcibly();
            run.terminate(spawnFailure(commandLine, e));
            return run;
        }

        CompletableFuture<Void> stdout = CompletableFuture.runAsync(
                () -> pump(process.getInputStream(), run, ProcessOutput.Stdout::new, "[STDOUT]: {}"), executor);
        CompletableFuture<Void> stderr = CompletableFuture.runAsync(
                () -> pump(process.getErrorStream(), run, ProcessOutput.Stderr::new, "[STDERR]: {}"), executor);

        CompletableFuture.allOf(stdout, stderr)
                .thenCompose(v -> process.onExit())
                .whenComplete((exited, error) -> {
                    if (error != null) {
                        log.error("Error while supervising '{}'", commandLine, error);
                        process.destroyForcibly();
                        run.terminate(new ProcessOutput.Failed("Error reading output of '" + commandLine
                                + "': " + rootMessage(error)));
                    } else {
                        log.info("Command '{}' exited with code {}", commandLine, exited.exitValue());
                        run.terminate(new ProcessOutput.Completed(exited.exitValue()));
                    }
                });
        return run;
    }

    Process start(List<String> command) throws IOException {
        return new ProcessBuilder(command).start();
    }

    private static ProcessOutput spawnFailure(String commandLine, Exception e) {
        return new ProcessOutput.Failed("Failed to spawn command: '" + commandLine + "'\nError:\n" + e.getMessage());
    }

    // build output goes to the persistent log at INFO
    private void pump(InputStream stream, ProcessRun run, Function<String, ProcessOutput> wrap, String logFormat) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info(logFormat, line);
                run.emit(wrap.apply(line));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
