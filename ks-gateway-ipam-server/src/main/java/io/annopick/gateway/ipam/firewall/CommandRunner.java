package io.annopick.gateway.ipam.firewall;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a command to completion and captures its output.
 */
@Slf4j
@Component
public class CommandRunner {

    private static final AtomicInteger DRAIN_THREAD_ID = new AtomicInteger();

    // Blocking reads stay off the common pool
    private static final ExecutorService STDERR_DRAINS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "command-stderr-" + DRAIN_THREAD_ID.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    });

    /**
     * @throws CommandException if the command cannot be started or exits non-zero
     */
    public CommandResult run(List<String> command) {
        String commandLine = String.join(" ", command);
        log.debug("Running \"{}\"", commandLine);
        Process process = start(command, commandLine);
        try {
            process.getOutputStream().close();
            // stderr is drained on its own thread so a chatty command cannot block on a full pipe
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
                () -> drain(process.getErrorStream()), STDERR_DRAINS);
            String stdout = drain(process.getInputStream());
            int exitCode = process.waitFor();
            String errors = stderr.join();
            log.debug("Process \"{}\" exited with code: {}", commandLine, exitCode);
            if (exitCode != 0) {
                throw new CommandException(commandLine, exitCode, errors);
            }
            return new CommandResult(commandLine, exitCode, stdout, errors);
        } catch (IOException | UncheckedIOException | CompletionException e) {
            process.destroyForcibly();
            throw new CommandException(commandLine, e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandException(commandLine, e);
        }
    }

    private static Process start(List<String> command, String commandLine) {
        try {
            return new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new CommandException(commandLine, e);
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
