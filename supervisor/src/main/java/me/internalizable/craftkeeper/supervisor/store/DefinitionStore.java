package me.internalizable.craftkeeper.supervisor.store;

import me.internalizable.craftkeeper.api.supervisor.ServerState;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of server definitions.
 *
 * <p>Implementations hand out copies; callers never observe later changes
 * through a returned definition.</p>
 */
public interface DefinitionStore {

    /**
     * Load every stored definition.
     *
     * @return definitions in insertion order
     * @throws IOException if the backing storage cannot be read
     */
    @Nonnull
    List<ServerDefinition> loadAll() throws IOException;

    @Nonnull
    Optional<ServerDefinition> find(@Nonnull String serverId);

    /**
     * Insert or replace a definition.
     *
     * @param definition definition to store
     * @throws IOException if the backing storage cannot be written
     */
    void save(@Nonnull ServerDefinition definition) throws IOException;

    /**
     * Remove a definition. Unknown ids are ignored.
     *
     * @param serverId server identifier
     * @throws IOException if the backing storage cannot be written
     */
    void delete(@Nonnull String serverId) throws IOException;

    /**
     * Record the last known status and pid of a server.
     *
     * @param serverId server identifier
     * @param status new status
     * @param pid process id, or null when no process is alive
     * @throws IOException if the backing storage cannot be written
     */
    void updateStatus(@Nonnull String serverId, @Nonnull ServerState status, @Nullable Long pid) throws IOException;
}
