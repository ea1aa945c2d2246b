package me.internalizable.craftkeeper.supervisor.process;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Spawns OS processes. The returned process must merge stderr into stdout.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * Launch a process.
     *
     * @param command what to run and where
     * @return the started process
     * @throws IOException if the process cannot be started
     */
    @Nonnull
    Process launch(@Nonnull LaunchCommand command) throws IOException;
}
