package me.internalizable.craftkeeper.supervisor.command;

import me.internalizable.craftkeeper.api.supervisor.ServerKind;
import me.internalizable.craftkeeper.supervisor.Await;
import me.internalizable.craftkeeper.supervisor.ServerSupervisor;
import me.internalizable.craftkeeper.supervisor.config.SupervisorConfig;
import me.internalizable.craftkeeper.supervisor.instance.TestServers;
import me.internalizable.craftkeeper.supervisor.process.FakeProcessLauncher;
import me.internalizable.craftkeeper.supervisor.store.InMemoryDefinitionStore;
import me.internalizable.craftkeeper.supervisor.store.ServerDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SupervisorCommandTest {

    @TempDir
    Path tempDir;

    private Path serversDir;
    private InMemoryDefinitionStore store;
    private FakeProcessLauncher launcher;
    private ServerSupervisor supervisor;
    private ByteArrayOutputStream buffer;
    private SupervisorCommand command;
    private ServerDefinition lobby;

    @BeforeEach
    void setUp() throws Exception {
        serversDir = tempDir.resolve("servers");
        SupervisorConfig config = new SupervisorConfig();
        config.setServersDirectory(serversDir.toString());
        store = new InMemoryDefinitionStore();
        launcher = new FakeProcessLauncher();

        lobby = TestServers.definition(serversDir, ServerKind.PAPER);
        lobby.setName("lobby");
        store.save(lobby);

        supervisor = new ServerSupervisor(config, TestServers.settings(), store, launcher);
        supervisor.initialize();

        buffer = new ByteArrayOutputStream();
        command = new SupervisorCommand(supervisor, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private void startLobby() throws Exception {
        CommandResult result = command.execute("start lobby");
        launcher.awaitLaunch(1, Duration.ofSeconds(5)).print(TestServers.READY_LINE);
        result.completion().get();
    }

    @Test
    void rejectsCommandsWhenSupervisorIsDown() {
        supervisor.shutdown();

        CommandResult result = command.execute("list");

        assertThat(result.success()).isFalse();
        assertThat(output()).contains("[X] Supervisor is not running.");
    }

    @Test
    void listShowsServersWithState() {
        CommandResult result = command.execute("list");

        assertThat(result.success()).isTrue();
        assertThat(output())
                .contains("○ lobby [paper] " + lobby.getId().substring(0, 8) + " :25565 (0/20)")
                .contains("Total: 1 server(s)");
    }

    @Test
    void listFiltersByState() throws Exception {
        startLobby();
        buffer.reset();

        command.execute("list stopped");
        assertThat(output()).contains("No servers found.");

        buffer.reset();
        command.execute("ls running");
        assertThat(output()).contains("● lobby");
    }

    @Test
    void listRejectsUnknownFilter() {
        CommandResult result = command.execute("list sleeping");

        assertThat(result.success()).isFalse();
        assertThat(output()).contains("Invalid filter");
    }

    @Test
    void infoAcceptsNameOrIdPrefix() {
        command.execute("info LOBBY");
        assertThat(output())
                .contains(">> Server: lobby <<")
                .contains("Id: " + lobby.getId())
                .contains("Status: stopped")
                .contains("Memory: 512M - 1024M");

        buffer.reset();
        CommandResult result = command.execute("i " + lobby.getId().substring(0, 6));
        assertThat(result.success()).isTrue();
        assertThat(output()).contains("Id: " + lobby.getId());
    }

    @Test
    void unknownServerIsReported() {
        CommandResult result = command.execute("start ghost");

        assertThat(result.success()).isFalse();
        assertThat(output()).contains("[X] Server not found: ghost");
        assertThat(launcher.commands()).isEmpty();
    }

    @Test
    void createProvisionsServer() {
        CommandResult result = command.execute("create hub velocity.jar --kind=velocity --port=25577 --max-players=500 --no-auto-restart");

        assertThat(result.success()).isTrue();
        ServerDefinition hub = supervisor.listDefinitions().stream()
                .filter(d -> d.getName().equals("hub"))
                .findFirst()
                .orElseThrow();
        assertThat(hub.getKind()).isEqualTo(ServerKind.VELOCITY);
        assertThat(hub.getPort()).isEqualTo(25577);
        assertThat(hub.getMaxPlayers()).isEqualTo(500);
        assertThat(hub.isAutoRestart()).isFalse();
        assertThat(output()).contains("[✓] Created server hub with id " + hub.getId());
    }

    @Test
    void createRejectsBadOptions() {
        assertThat(command.execute("create hub").success()).isFalse();
        assertThat(command.execute("create hub hub.jar --port=abc").message()).isEqualTo("Invalid number");
        assertThat(command.execute("create hub hub.jar --colour=blue").message()).isEqualTo("Unknown option");
        assertThat(command.execute("create hub hub.jar --kind=bukkit").success()).isFalse();
        assertThat(command.execute("create hub hub.jar --min-ram=4096 --max-ram=1024").success()).isFalse();
        assertThat(supervisor.listDefinitions()).hasSize(1);
    }

    @Test
    void startReportsSettledState() throws Exception {
        startLobby();

        assertThat(output())
                .contains("[*] Start requested for " + lobby.getId())
                .contains("[✓] Server " + lobby.getId() + " is now running.");
    }

    @Test
    void failedOperationIsPrintedNotThrown() throws Exception {
        CommandResult result = command.execute("stop lobby");
        result.completion().get();

        assertThat(result.success()).isTrue();
        assertThat(output()).contains("[X] Failed to stop: ");
    }

    @Test
    void sendWritesToConsole() throws Exception {
        startLobby();

        CommandResult result = command.execute("send lobby say hello world");

        assertThat(result.success()).isTrue();
        assertThat(launcher.last().stdinLines()).contains("say hello world");
    }

    @Test
    void sendWithoutProcessFails() {
        CommandResult result = command.execute("cmd lobby list");

        assertThat(result.success()).isFalse();
        assertThat(output()).contains("has no running process");
    }

    @Test
    void logsShowsRecentOutput() throws Exception {
        startLobby();
        launcher.last().print("[12:00:05] [Server thread/INFO]: first");
        launcher.last().print("[12:00:06] [Server thread/INFO]: second");
        Await.until(() -> supervisor.tailLogs(lobby.getId(), 1).get(0).endsWith("second"), "log captured");

        command.execute("logs lobby --tail=2");

        assertThat(output())
                .contains("Logs: " + lobby.getId() + " (last 2)")
                .contains("[12:00:05] [Server thread/INFO]: first")
                .contains("[12:00:06] [Server thread/INFO]: second")
                .doesNotContain("Done (3.215s)");
    }

    @Test
    void playersListsConnectedPlayers() throws Exception {
        startLobby();
        launcher.last().print("[12:00:10] [Server thread/INFO]: Steve joined the game");
        Await.until(() -> supervisor.getStatus(lobby.getId()).connectedPlayers() == 1, "player joined");

        command.execute("players lobby");

        assertThat(output()).contains("Players: " + lobby.getId() + " (1)").contains("  - Steve");
    }

    @Test
    void deleteRemovesServer() throws Exception {
        CommandResult result = command.execute("rm lobby --purge");
        result.completion().get();

        assertThat(supervisor.listDefinitions()).isEmpty();
        assertThat(output()).contains("[✓] Server " + lobby.getId() + " deleted.");
    }

    @Test
    void unknownSubcommandShowsHelp() {
        command.execute("frobnicate");

        assertThat(output())
                .contains("[X] Unknown subcommand: frobnicate")
                .contains(">> Supervisor Commands <<");
    }

    @Test
    void statsSummarizesRegistry() throws Exception {
        startLobby();

        command.execute("stats");

        assertThat(output()).contains("Servers: 1").contains("Active: 1").contains("Crashed: 0");
    }

    @Test
    void resolvesIdsPrefixesAndNames() throws Exception {
        ServerDefinition twin = TestServers.definition(serversDir, ServerKind.PAPER);
        twin.setName("lobby");
        store.save(twin);
        ServerSupervisor other = new ServerSupervisor(supervisorConfig(), TestServers.settings(), store, launcher);
        other.initialize();
        try {
            SupervisorCommand twins = new SupervisorCommand(other, new PrintStream(new ByteArrayOutputStream()));

            assertThat(twins.resolveServerId(lobby.getId())).isEqualTo(lobby.getId());
            assertThat(twins.resolveServerId(twin.getId())).isEqualTo(twin.getId());
            assertThat(twins.resolveServerId("lobby")).isNull();
            assertThat(twins.resolveServerId("nothing-like-this")).isNull();
        } finally {
            other.shutdown();
        }
    }

    @Test
    void formatsDurations() {
        assertThat(SupervisorCommand.formatDuration(45)).isEqualTo("45s");
        assertThat(SupervisorCommand.formatDuration(125)).isEqualTo("2m 5s");
        assertThat(SupervisorCommand.formatDuration(3725)).isEqualTo("1h 2m");
    }

    private SupervisorConfig supervisorConfig() {
        SupervisorConfig config = new SupervisorConfig();
        config.setServersDirectory(serversDir.toString());
        return config;
    }
}
