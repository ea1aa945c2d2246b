package me.internalizable.craftkeeper.supervisor.command;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SupervisorConsoleTest {

    @Mock
    private SupervisorCommand command;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private final AtomicInteger exits = new AtomicInteger();

    private SupervisorConsole console(String input) {
        return new SupervisorConsole(command,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out, exits::incrementAndGet);
    }

    @Test
    void forwardsLinesUntilExit() {
        when(command.execute(anyString())).thenReturn(CommandResult.ok());

        console("list\n\n  info lobby  \nexit\nstart lobby\n").run();

        verify(command).execute("list");
        verify(command).execute("info lobby");
        verify(command, never()).execute("start lobby");
        assertThat(exits).hasValue(1);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("craftkeeper> ");
    }

    @Test
    void endOfInputRunsExitAction() {
        SupervisorConsole console = console("");

        console.run();

        assertThat(exits).hasValue(1);
        assertThat(console.isRunning()).isFalse();
    }

    @Test
    void commandFailureDoesNotEndLoop() {
        when(command.execute("boom")).thenThrow(new IllegalStateException("exploded"));
        when(command.execute("help")).thenReturn(CommandResult.ok());

        console("boom\nhelp\nquit\n").run();

        verify(command).execute("help");
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("Error: exploded");
        assertThat(exits).hasValue(1);
    }
}
