package me.internalizable.craftkeeper.supervisor.store;

import me.internalizable.craftkeeper.api.supervisor.ServerState;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Non-durable store, for embedding and tests.
 */
public class InMemoryDefinitionStore implements DefinitionStore {

    private final Map<String, ServerDefinition> definitions = new LinkedHashMap<>();

    @Override
    @Nonnull
    public synchronized List<ServerDefinition> loadAll() {
        List<ServerDefinition> result = new ArrayList<>(definitions.size());
        for (ServerDefinition definition : definitions.values()) {
            result.add(definition.copy());
        }
        return result;
    }

    @Override
    @Nonnull
    public synchronized Optional<ServerDefinition> find(@Nonnull String serverId) {
        ServerDefinition definition = definitions.get(serverId);
        return definition != null ? Optional.of(definition.copy()) : Optional.empty();
    }

    @Override
    public synchronized void save(@Nonnull ServerDefinition definition) {
        Objects.requireNonNull(definition.getId(), "definition.id");
        definitions.put(definition.getId(), definition.copy());
    }

    @Override
    public synchronized void delete(@Nonnull String serverId) {
        definitions.remove(serverId);
    }

    @Override
    public synchronized void updateStatus(@Nonnull String serverId, @Nonnull ServerState status, @Nullable Long pid) {
        ServerDefinition definition = definitions.get(serverId);
        if (definition != null) {
            definition.setStatus(status);
            definition.setPid(pid);
            definition.setUpdatedAt(System.currentTimeMillis());
        }
    }
}
