package me.internalizable.craftkeeper.supervisor.process;

import javax.annotation.Nonnull;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Represents one spawned server process.
 *
 * <p>Wraps a Java {@link Process} with its start time and a line-oriented,
 * synchronized stdin writer.</p>
 */
public class ManagedProcess {

    private final String serverId;
    private final Process process;
    private final Instant startTime;
    private final BufferedWriter stdin;

    /**
     * Create a managed process.
     *
     * @param serverId server identifier
     * @param process the started process
     */
    public ManagedProcess(@Nonnull String serverId, @Nonnull Process process) {
        this.serverId = Objects.requireNonNull(serverId, "serverId");
        this.process = Objects.requireNonNull(process, "process");
        this.startTime = Instant.now();
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    @Nonnull
    public String getServerId() {
        return serverId;
    }

    /**
     * Get the process ID.
     *
     * @return PID, or -1 if the platform does not expose it
     */
    public long getPid() {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }

    @Nonnull
    public Instant getStartTime() {
        return startTime;
    }

    /**
     * Get the process uptime.
     *
     * @return time since spawn
     */
    @Nonnull
    public Duration getUptime() {
        return Duration.between(startTime, Instant.now());
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Get the merged stdout/stderr stream.
     */
    @Nonnull
    public InputStream getOutput() {
        return process.getInputStream();
    }

    /**
     * Write one line to the process's stdin and flush it.
     *
     * @param line line without trailing newline
     * @throws IOException if stdin is closed
     */
    public synchronized void sendLine(@Nonnull String line) throws IOException {
        stdin.write(line);
        stdin.newLine();
        stdin.flush();
    }

    /**
     * Wait for the process to exit.
     *
     * @param timeout maximum time to wait
     * @return true if the process exited within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean waitFor(@Nonnull Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Wait for the process to exit and return its exit code.
     *
     * @return exit code
     * @throws InterruptedException if interrupted while waiting
     */
    public int waitForExit() throws InterruptedException {
        return process.waitFor();
    }

    @Nonnull
    public CompletableFuture<Process> onExit() {
        return process.onExit();
    }

    /**
     * Forcibly terminate the process (SIGKILL on Unix).
     */
    public void destroyForcibly() {
        process.destroyForcibly();
    }

    @Override
    public String toString() {
        return "ManagedProcess{" +
                "serverId='" + serverId + '\'' +
                ", pid=" + getPid() +
                ", alive=" + isAlive() +
                ", uptime=" + getUptime().toMillis() + "ms" +
                '}';
    }
}
