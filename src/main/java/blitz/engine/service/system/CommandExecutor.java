package blitz.engine.service.system;

import blitz.engine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs short, non-interactive commands and captures their standard output.
 * Long running builds go through the process supervisor instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandExecutor {
    private final ExecutorService engineExecutor;
    private final EngineProperties properties;

    public String execSimple(List<String> command) throws SystemCommandException {
        String commandLine = String.join(" ", command);
        Duration timeout = properties.getCommandTimeout();
        log.debug("Executing command: {}", commandLine);

        Process process;
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectError(ProcessBuilder.Redirect.DISCARD);
            process = processBuilder.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new SystemCommandException("Failed to run command '" + commandLine + "': " + e.getMessage(), e);
        }

        // stdout is drained on its own task so the timeout applies even if the pipe stays open
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(
                () -> readAll(process.getInputStream()), engineExecutor);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                stdout.cancel(true);
                throw new SystemCommandException("Command '" + commandLine + "' timed out after "
                        + timeout.toSeconds() + " seconds");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new SystemCommandException("Command '" + commandLine + "' failed with exit code: " + exitCode);
            }
            return stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SystemCommandException("Interrupted while running '" + commandLine + "'", e);
        } catch (ExecutionException e) {
            throw new SystemCommandException("Failed to read output of '" + commandLine + "': "
                    + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new SystemCommandException("Output of '" + commandLine + "' was not closed after the command exited", e);
        }
    }

    private static String readAll(InputStream stream) {
        try (InputStream in = stream) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
