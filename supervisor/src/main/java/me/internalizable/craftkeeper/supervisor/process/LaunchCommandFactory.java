package me.internalizable.craftkeeper.supervisor.process;

import me.internalizable.craftkeeper.supervisor.store.ServerDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a server definition into a {@link LaunchCommand}.
 *
 * <p>Also prepares the working directory: verifies the directory and jar
 * exist and, for game servers, accepts the EULA when configured to.</p>
 */
public class LaunchCommandFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(LaunchCommandFactory.class);

    /**
     * G1 tuning widely used for game servers, appended after user flags.
     */
    static final List<String> DEFAULT_JVM_FLAGS = List.of(
            "-XX:+UseG1GC",
            "-XX:+ParallelRefProcEnabled",
            "-XX:MaxGCPauseMillis=200",
            "-XX:+UnlockExperimentalVMOptions",
            "-XX:+DisableExplicitGC",
            "-XX:+AlwaysPreTouch",
            "-XX:G1NewSizePercent=30",
            "-XX:G1MaxNewSizePercent=40",
            "-XX:G1HeapRegionSize=8M",
            "-XX:G1ReservePercent=20",
            "-XX:G1HeapWastePercent=5",
            "-XX:G1MixedGCCountTarget=4",
            "-XX:InitiatingHeapOccupancyPercent=15",
            "-XX:G1MixedGCLiveThresholdPercent=90",
            "-XX:G1RSetUpdatingPauseTimePercent=5",
            "-XX:SurvivorRatio=32",
            "-XX:+PerfDisableSharedMem",
            "-XX:MaxTenuringThreshold=1"
    );

    private final String defaultJavaPath;
    private final boolean useDefaultJvmFlags;
    private final boolean acceptEula;

    /**
     * Create a launch command factory.
     *
     * @param defaultJavaPath java executable for definitions without their own
     * @param useDefaultJvmFlags append {@link #DEFAULT_JVM_FLAGS}
     * @param acceptEula write {@code eula=true} for game servers before launch
     */
    public LaunchCommandFactory(@Nonnull String defaultJavaPath, boolean useDefaultJvmFlags, boolean acceptEula) {
        this.defaultJavaPath = Objects.requireNonNull(defaultJavaPath, "defaultJavaPath");
        this.useDefaultJvmFlags = useDefaultJvmFlags;
        this.acceptEula = acceptEula;
    }

    /**
     * Validate the definition's files and build its launch command.
     *
     * @param definition server definition
     * @return launch command
     * @throws IOException if the working directory or jar is missing, or the EULA cannot be written
     */
    @Nonnull
    public LaunchCommand create(@Nonnull ServerDefinition definition) throws IOException {
        Objects.requireNonNull(definition, "definition");

        Path workingDir = definition.getDirectoryPath();
        if (!Files.isDirectory(workingDir)) {
            throw new IOException("Working directory does not exist: " + workingDir);
        }
        if (definition.getJarFile() == null || !Files.isRegularFile(workingDir.resolve(definition.getJarFile()))) {
            throw new IOException("Server jar not found: " + workingDir.resolve(String.valueOf(definition.getJarFile())));
        }

        if (acceptEula && !definition.getKind().isProxy()) {
            writeEula(workingDir);
        }

        return new LaunchCommand(buildCommand(definition), workingDir, buildEnvironment(definition));
    }

    @Nonnull
    List<String> buildCommand(@Nonnull ServerDefinition definition) {
        List<String> command = new ArrayList<>();
        String javaPath = definition.getJavaPath();
        command.add(javaPath != null && !javaPath.isBlank() ? javaPath : defaultJavaPath);

        if (definition.getMinRamMb() > 0) {
            command.add("-Xms" + definition.getMinRamMb() + "M");
        }
        if (definition.getMaxRamMb() > 0) {
            command.add("-Xmx" + definition.getMaxRamMb() + "M");
        }

        command.addAll(definition.getJvmFlags());

        if (useDefaultJvmFlags) {
            command.addAll(DEFAULT_JVM_FLAGS);
        }

        command.add("-jar");
        command.add(definition.getJarFile());

        if (!definition.getKind().isProxy()) {
            command.add("nogui");
        }
        return command;
    }

    private Map<String, String> buildEnvironment(ServerDefinition definition) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("CRAFTKEEPER_SERVER_ID", definition.getId());
        env.put("CRAFTKEEPER_SERVER_PORT", String.valueOf(definition.getPort()));
        env.putAll(definition.getEnvironment());
        return env;
    }

    private void writeEula(Path workingDir) throws IOException {
        Path eula = workingDir.resolve("eula.txt");
        if (Files.exists(eula) && Files.readString(eula, StandardCharsets.UTF_8).contains("eula=true")) {
            return;
        }
        Files.writeString(eula, "eula=true\n", StandardCharsets.UTF_8);
        LOGGER.debug("Accepted EULA in {}", workingDir);
    }
}
