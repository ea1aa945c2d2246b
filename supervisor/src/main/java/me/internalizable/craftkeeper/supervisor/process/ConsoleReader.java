package me.internalizable.craftkeeper.supervisor.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Drains a process's console output on a dedicated daemon thread.
 *
 * <p>Lines are handed to the callback in order. Once the output reaches end
 * of stream the reader waits for the process to exit and reports the exit
 * code, so every line a process printed is delivered before its exit.</p>
 */
public final class ConsoleReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleReader.class);

    /**
     * Receives console output and the exit of one process.
     */
    public interface Callback {

        void onLine(@Nonnull ManagedProcess process, @Nonnull String line);

        void onExit(@Nonnull ManagedProcess process, int exitCode);
    }

    private ConsoleReader() {
    }

    /**
     * Start reading a process's output.
     *
     * @param process process to read
     * @param callback receiver of lines and the exit code
     * @return the started reader thread
     */
    @Nonnull
    public static Thread start(@Nonnull ManagedProcess process, @Nonnull Callback callback) {
        Objects.requireNonNull(process, "process");
        Objects.requireNonNull(callback, "callback");

        Thread thread = new Thread(() -> run(process, callback), "ConsoleReader-" + process.getServerId());
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void run(ManagedProcess process, Callback callback) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getOutput(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                try {
                    callback.onLine(process, line);
                } catch (RuntimeException e) {
                    LOGGER.error("Error handling console line of '{}'", process.getServerId(), e);
                }
            }
        } catch (IOException e) {
            LOGGER.debug("Console stream of '{}' closed: {}", process.getServerId(), e.getMessage());
        }

        int exitCode;
        try {
            exitCode = process.waitForExit();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for '{}' to exit", process.getServerId());
            return;
        }
        callback.onExit(process, exitCode);
    }
}
