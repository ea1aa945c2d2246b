package me.internalizable.craftkeeper.supervisor.process;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Launcher that hands out {@link FakeProcess}es and records every launch.
 */
public class FakeProcessLauncher implements ProcessLauncher {

    private final List<LaunchCommand> commands = new CopyOnWriteArrayList<>();
    private final List<FakeProcess> processes = new CopyOnWriteArrayList<>();
    private volatile Supplier<FakeProcess> factory = FakeProcess::new;
    private volatile IOException failure;
    private volatile CountDownLatch gate;

    public FakeProcessLauncher producing(Supplier<FakeProcess> factory) {
        this.factory = factory;
        return this;
    }

    public FakeProcessLauncher failingWith(IOException failure) {
        this.failure = failure;
        return this;
    }

    /**
     * Hold every launch after it is recorded until {@code gate} opens.
     */
    public FakeProcessLauncher gatedBy(CountDownLatch gate) {
        this.gate = gate;
        return this;
    }

    @Override
    public Process launch(LaunchCommand command) throws IOException {
        commands.add(command);
        CountDownLatch held = gate;
        if (held != null) {
            try {
                held.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("launch interrupted");
            }
        }
        if (failure != null) {
            throw failure;
        }
        FakeProcess process = factory.get();
        processes.add(process);
        return process;
    }

    public List<LaunchCommand> commands() {
        return commands;
    }

    public List<FakeProcess> processes() {
        return processes;
    }

    public FakeProcess last() {
        if (processes.isEmpty()) {
            throw new IllegalStateException("nothing launched");
        }
        return processes.get(processes.size() - 1);
    }

    public long aliveCount() {
        return processes.stream().filter(FakeProcess::isAlive).count();
    }

    /**
     * Wait until at least {@code count} processes were launched.
     */
    public FakeProcess awaitLaunch(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (processes.size() < count) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("expected " + count + " launches but saw " + processes.size());
            }
            Thread.sleep(10);
        }
        return processes.get(count - 1);
    }
}
