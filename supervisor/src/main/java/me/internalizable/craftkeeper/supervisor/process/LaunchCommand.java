package me.internalizable.craftkeeper.supervisor.process;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to spawn one server process.
 *
 * @param command executable followed by its arguments
 * @param workingDirectory process working directory
 * @param environment variables added to the inherited environment
 */
public record LaunchCommand(
        @Nonnull List<String> command,
        @Nonnull Path workingDirectory,
        @Nonnull Map<String, String> environment
) {

    public LaunchCommand {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
    }

    /**
     * Get the command line as a single string, for logs.
     */
    @Nonnull
    public String commandLine() {
        return String.join(" ", command);
    }
}
