package me.internalizable.craftkeeper.supervisor.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Launches real OS processes through {@link ProcessBuilder}.
 */
public class SystemProcessLauncher implements ProcessLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemProcessLauncher.class);

    @Override
    @Nonnull
    public Process launch(@Nonnull LaunchCommand command) throws IOException {
        LOGGER.debug("Command: {}", command.commandLine());

        ProcessBuilder builder = new ProcessBuilder(command.command());
        builder.directory(command.workingDirectory().toFile());
        builder.redirectErrorStream(true);
        builder.environment().putAll(command.environment());

        return builder.start();
    }
}
