package me.internalizable.craftkeeper.supervisor.store;

import me.internalizable.craftkeeper.api.supervisor.ServerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Definition store backed by a single YAML file.
 *
 * <p>The file is read once, lazily, and rewritten in full after every
 * change. Writes go to a sibling temporary file that is then moved over the
 * original so a crash never leaves a truncated file behind.</p>
 */
public class YamlDefinitionStore implements DefinitionStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(YamlDefinitionStore.class);

    private final Path file;
    private Map<String, ServerDefinition> definitions;

    public YamlDefinitionStore(@Nonnull Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    @Nonnull
    public synchronized List<ServerDefinition> loadAll() throws IOException {
        List<ServerDefinition> result = new ArrayList<>();
        for (ServerDefinition definition : definitions().values()) {
            result.add(definition.copy());
        }
        return result;
    }

    @Override
    @Nonnull
    public synchronized Optional<ServerDefinition> find(@Nonnull String serverId) {
        try {
            ServerDefinition definition = definitions().get(serverId);
            return definition != null ? Optional.of(definition.copy()) : Optional.empty();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read definitions from " + file, e);
        }
    }

    @Override
    public synchronized void save(@Nonnull ServerDefinition definition) throws IOException {
        Objects.requireNonNull(definition.getId(), "definition.id");
        definitions().put(definition.getId(), definition.copy());
        write();
    }

    @Override
    public synchronized void delete(@Nonnull String serverId) throws IOException {
        if (definitions().remove(serverId) != null) {
            write();
        }
    }

    @Override
    public synchronized void updateStatus(@Nonnull String serverId, @Nonnull ServerState status,
                                          @Nullable Long pid) throws IOException {
        ServerDefinition definition = definitions().get(serverId);
        if (definition == null) {
            LOGGER.debug("Ignoring status update for unknown server '{}'", serverId);
            return;
        }
        definition.setStatus(status);
        definition.setPid(pid);
        definition.setUpdatedAt(System.currentTimeMillis());
        write();
    }

    private Map<String, ServerDefinition> definitions() throws IOException {
        if (definitions == null) {
            definitions = read();
        }
        return definitions;
    }

    private Map<String, ServerDefinition> read() throws IOException {
        Map<String, ServerDefinition> result = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return result;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(DefinitionFile.class, options));
        try (InputStream is = Files.newInputStream(file)) {
            DefinitionFile loaded;
            try {
                loaded = yaml.load(is);
            } catch (YAMLException e) {
                throw new IOException("Malformed definitions file " + file + ": " + e.getMessage(), e);
            }
            if (loaded != null && loaded.getServers() != null) {
                for (ServerDefinition definition : loaded.getServers()) {
                    if (definition.getId() == null) {
                        LOGGER.warn("Skipping server definition without id in {}", file);
                        continue;
                    }
                    result.put(definition.getId(), definition);
                }
            }
        }
        LOGGER.info("Loaded {} server definition(s) from {}", result.size(), file);
        return result;
    }

    private void write() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DefinitionFile content = new DefinitionFile();
        content.setServers(new ArrayList<>(definitions.values()));

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp)) {
            writer.write(new Yaml().dumpAsMap(content));
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Root document of the definitions file.
     */
    public static class DefinitionFile {
        private List<ServerDefinition> servers = new ArrayList<>();

        public List<ServerDefinition> getServers() {
            return servers;
        }

        public void setServers(List<ServerDefinition> servers) {
            this.servers = servers;
        }
    }
}
