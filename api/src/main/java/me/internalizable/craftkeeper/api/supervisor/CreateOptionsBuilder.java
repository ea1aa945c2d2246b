package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builder implementation for server creation options.
 */
public class CreateOptionsBuilder implements SupervisorAPI.CreateOptions.Builder {

    private String name;
    private ServerKind kind = ServerKind.VANILLA;
    private String version;
    private String jarFile;
    private String javaPath;
    private int minRamMb = -1;
    private int maxRamMb = -1;
    private final List<String> jvmFlags = new ArrayList<>();
    private int port = -1;
    private int maxPlayers = -1;
    private boolean autoStart;
    private boolean autoRestart = true;
    private final Map<String, String> environment = new LinkedHashMap<>();

    @Override
    public SupervisorAPI.CreateOptions.Builder name(@Nonnull String name) {
        this.name = Objects.requireNonNull(name, "name");
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder kind(@Nonnull ServerKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder version(@Nullable String version) {
        this.version = version;
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder jarFile(@Nonnull String jarFile) {
        this.jarFile = Objects.requireNonNull(jarFile, "jarFile");
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder javaPath(@Nullable String javaPath) {
        this.javaPath = javaPath;
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder minRamMb(int minRamMb) {
        this.minRamMb = minRamMb;
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder maxRamMb(int maxRamMb) {
        this.maxRamMb = maxRamMb;
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder jvmFlag(@Nonnull String flag) {
        this.jvmFlags.add(Objects.requireNonNull(flag, "flag"));
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder port(int port) {
        this.port = port;
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder maxPlayers(int maxPlayers) {
        this.maxPlayers = maxPlayers;
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder autoStart(boolean autoStart) {
        this.autoStart = autoStart;
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder autoRestart(boolean autoRestart) {
        this.autoRestart = autoRestart;
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions.Builder environment(@Nonnull String key, @Nonnull String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        this.environment.put(key, value);
        return this;
    }

    @Override
    public SupervisorAPI.CreateOptions build() {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("Server name is required");
        }
        if (jarFile == null || jarFile.isBlank()) {
            throw new IllegalStateException("Server jar file is required");
        }
        if (minRamMb > 0 && maxRamMb > 0 && minRamMb > maxRamMb) {
            throw new IllegalStateException("minRamMb (" + minRamMb + ") exceeds maxRamMb (" + maxRamMb + ")");
        }
        return new CreateOptionsImpl(name, kind, version, jarFile, javaPath, minRamMb, maxRamMb,
                List.copyOf(jvmFlags), port, maxPlayers, autoStart, autoRestart, Map.copyOf(environment));
    }

    private record CreateOptionsImpl(
            String name,
            ServerKind kind,
            String version,
            String jarFile,
            String javaPath,
            int minRamMb,
            int maxRamMb,
            List<String> jvmFlags,
            int port,
            int maxPlayers,
            boolean autoStart,
            boolean autoRestart,
            Map<String, String> environment
    ) implements SupervisorAPI.CreateOptions {

        @Override
        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        @Nonnull
        public ServerKind getKind() {
            return kind;
        }

        @Override
        @Nullable
        public String getVersion() {
            return version;
        }

        @Override
        @Nonnull
        public String getJarFile() {
            return jarFile;
        }

        @Override
        @Nullable
        public String getJavaPath() {
            return javaPath;
        }

        @Override
        public int getMinRamMb() {
            return minRamMb;
        }

        @Override
        public int getMaxRamMb() {
            return maxRamMb;
        }

        @Override
        @Nonnull
        public List<String> getJvmFlags() {
            return jvmFlags;
        }

        @Override
        public int getPort() {
            return port;
        }

        @Override
        public int getMaxPlayers() {
            return maxPlayers;
        }

        @Override
        public boolean isAutoStart() {
            return autoStart;
        }

        @Override
        public boolean isAutoRestart() {
            return autoRestart;
        }

        @Override
        @Nonnull
        public Map<String, String> getEnvironment() {
            return environment;
        }
    }
}
