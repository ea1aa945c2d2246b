package me.internalizable.craftkeeper.supervisor.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads operator commands line by line and hands them to a {@link SupervisorCommand}.
 *
 * <p>{@code exit} or end of input stops the loop and runs the exit action.</p>
 */
public class SupervisorConsole implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SupervisorConsole.class);
    private static final String PROMPT = "craftkeeper> ";

    private final SupervisorCommand command;
    private final InputStream in;
    private final PrintStream out;
    private final Runnable exitAction;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consoleThread;

    public SupervisorConsole(@Nonnull SupervisorCommand command, @Nonnull InputStream in,
                             @Nonnull PrintStream out, @Nonnull Runnable exitAction) {
        this.command = Objects.requireNonNull(command, "command");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.exitAction = Objects.requireNonNull(exitAction, "exitAction");
    }

    /**
     * Start reading on a dedicated thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            consoleThread = new Thread(this, "Supervisor-Console");
            consoleThread.setDaemon(false);
            consoleThread.start();
            LOGGER.info("Interactive console started");
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consoleThread != null) {
                consoleThread.interrupt();
            }
            LOGGER.info("Interactive console stopped");
        }
    }

    @Override
    public void run() {
        running.set(true);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));

        out.println("CraftKeeper console");
        out.println("Type 'help' for available commands, 'exit' to quit");

        while (running.get()) {
            try {
                out.print(PROMPT);
                out.flush();

                String input = reader.readLine();
                if (input == null) {
                    break;
                }

                input = input.trim();
                if (input.isEmpty()) {
                    continue;
                }
                if (input.equalsIgnoreCase("exit") || input.equalsIgnoreCase("quit")) {
                    break;
                }

                command.execute(input);
                out.println();
            } catch (IOException e) {
                if (running.get()) {
                    LOGGER.error("Error reading console input", e);
                }
                break;
            } catch (RuntimeException e) {
                LOGGER.error("Unexpected error in console", e);
                out.println("Error: " + e.getMessage());
            }
        }

        running.set(false);
        exitAction.run();
    }

    public boolean isRunning() {
        return running.get();
    }
}
