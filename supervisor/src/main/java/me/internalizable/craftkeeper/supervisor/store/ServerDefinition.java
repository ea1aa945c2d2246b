package me.internalizable.craftkeeper.supervisor.store;

import me.internalizable.craftkeeper.api.supervisor.ServerKind;
import me.internalizable.craftkeeper.api.supervisor.ServerState;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable description of one managed server.
 *
 * <p>Plain bean so it can be written to and read from YAML. The last known
 * status and pid are only hints: at boot every server is reset to
 * {@link ServerState#STOPPED}.</p>
 */
public class ServerDefinition {

    private String id;
    private String name;
    private ServerKind kind = ServerKind.VANILLA;
    private String version;
    private String directory;
    private String jarFile;
    private String javaPath;
    private int minRamMb;
    private int maxRamMb;
    private List<String> jvmFlags = new ArrayList<>();
    private Map<String, String> environment = new LinkedHashMap<>();
    private int port;
    private int maxPlayers;
    private boolean autoStart;
    private boolean autoRestart = true;
    private ServerState status = ServerState.STOPPED;
    private Long pid;
    private long createdAt;
    private long updatedAt;

    /**
     * Create a detached copy, safe to hand to other threads.
     *
     * @return deep copy of this definition
     */
    public ServerDefinition copy() {
        ServerDefinition copy = new ServerDefinition();
        copy.id = id;
        copy.name = name;
        copy.kind = kind;
        copy.version = version;
        copy.directory = directory;
        copy.jarFile = jarFile;
        copy.javaPath = javaPath;
        copy.minRamMb = minRamMb;
        copy.maxRamMb = maxRamMb;
        copy.jvmFlags = new ArrayList<>(jvmFlags);
        copy.environment = new LinkedHashMap<>(environment);
        copy.port = port;
        copy.maxPlayers = maxPlayers;
        copy.autoStart = autoStart;
        copy.autoRestart = autoRestart;
        copy.status = status;
        copy.pid = pid;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    public Path getDirectoryPath() {
        return Path.of(directory);
    }

    // Getters and Setters

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ServerKind getKind() {
        return kind;
    }

    public void setKind(ServerKind kind) {
        this.kind = kind;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public String getJarFile() {
        return jarFile;
    }

    public void setJarFile(String jarFile) {
        this.jarFile = jarFile;
    }

    public String getJavaPath() {
        return javaPath;
    }

    public void setJavaPath(String javaPath) {
        this.javaPath = javaPath;
    }

    public int getMinRamMb() {
        return minRamMb;
    }

    public void setMinRamMb(int minRamMb) {
        this.minRamMb = minRamMb;
    }

    public int getMaxRamMb() {
        return maxRamMb;
    }

    public void setMaxRamMb(int maxRamMb) {
        this.maxRamMb = maxRamMb;
    }

    public List<String> getJvmFlags() {
        return jvmFlags;
    }

    public void setJvmFlags(List<String> jvmFlags) {
        this.jvmFlags = jvmFlags != null ? jvmFlags : new ArrayList<>();
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public void setEnvironment(Map<String, String> environment) {
        this.environment = environment != null ? environment : new LinkedHashMap<>();
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public void setMaxPlayers(int maxPlayers) {
        this.maxPlayers = maxPlayers;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isAutoRestart() {
        return autoRestart;
    }

    public void setAutoRestart(boolean autoRestart) {
        this.autoRestart = autoRestart;
    }

    public ServerState getStatus() {
        return status;
    }

    public void setStatus(ServerState status) {
        this.status = status;
    }

    public Long getPid() {
        return pid;
    }

    public void setPid(Long pid) {
        this.pid = pid;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "ServerDefinition{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", kind=" + kind +
                ", port=" + port +
                ", status=" + status +
                '}';
    }
}
