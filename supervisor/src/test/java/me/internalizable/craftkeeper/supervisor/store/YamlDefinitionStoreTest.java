package me.internalizable.craftkeeper.supervisor.store;

import me.internalizable.craftkeeper.api.supervisor.ServerKind;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlDefinitionStoreTest {

    @TempDir
    Path dir;

    private static ServerDefinition definition(String id, ServerKind kind) {
        ServerDefinition definition = new ServerDefinition();
        definition.setId(id);
        definition.setName("Survival " + id);
        definition.setKind(kind);
        definition.setVersion("1.20.4");
        definition.setDirectory("/srv/minecraft/" + id);
        definition.setJarFile("paper.jar");
        definition.setMinRamMb(2048);
        definition.setMaxRamMb(6144);
        definition.setJvmFlags(List.of("-Dcom.mojang.eula.agree=true"));
        definition.setEnvironment(Map.of("TZ", "UTC"));
        definition.setPort(25566);
        definition.setMaxPlayers(50);
        definition.setAutoStart(true);
        definition.setCreatedAt(1_700_000_000_000L);
        return definition;
    }

    @Test
    void savedDefinitionsSurviveReload() throws IOException {
        Path file = dir.resolve("definitions.yml");
        YamlDefinitionStore store = new YamlDefinitionStore(file);
        store.save(definition("alpha", ServerKind.PAPER));
        store.save(definition("beta", ServerKind.VELOCITY));

        List<ServerDefinition> loaded = new YamlDefinitionStore(file).loadAll();

        assertThat(loaded).extracting(ServerDefinition::getId).containsExactly("alpha", "beta");
        ServerDefinition alpha = loaded.get(0);
        assertThat(alpha.getKind()).isEqualTo(ServerKind.PAPER);
        assertThat(alpha.getName()).isEqualTo("Survival alpha");
        assertThat(alpha.getVersion()).isEqualTo("1.20.4");
        assertThat(alpha.getMaxRamMb()).isEqualTo(6144);
        assertThat(alpha.getJvmFlags()).containsExactly("-Dcom.mojang.eula.agree=true");
        assertThat(alpha.getEnvironment()).containsEntry("TZ", "UTC");
        assertThat(alpha.isAutoStart()).isTrue();
        assertThat(alpha.getStatus()).isEqualTo(ServerState.STOPPED);
        assertThat(alpha.getCreatedAt()).isEqualTo(1_700_000_000_000L);
    }

    @Test
    void fileHasNoJavaTypeTags() throws IOException {
        Path file = dir.resolve("definitions.yml");
        new YamlDefinitionStore(file).save(definition("alpha", ServerKind.FORGE));

        String content = Files.readString(file);

        assertThat(content).doesNotContain("!!").contains("kind: FORGE");
        assertThat(dir.resolve("definitions.yml.tmp")).doesNotExist();
    }

    @Test
    void statusUpdatesArePersisted() throws IOException {
        Path file = dir.resolve("definitions.yml");
        YamlDefinitionStore store = new YamlDefinitionStore(file);
        store.save(definition("alpha", ServerKind.PAPER));

        store.updateStatus("alpha", ServerState.RUNNING, 4242L);

        ServerDefinition reloaded = new YamlDefinitionStore(file).find("alpha").orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(ServerState.RUNNING);
        assertThat(reloaded.getPid()).isEqualTo(4242L);
    }

    @Test
    void statusUpdateForUnknownServerIsIgnored() throws IOException {
        Path file = dir.resolve("definitions.yml");
        YamlDefinitionStore store = new YamlDefinitionStore(file);

        store.updateStatus("ghost", ServerState.RUNNING, 1L);

        assertThat(store.loadAll()).isEmpty();
        assertThat(file).doesNotExist();
    }

    @Test
    void deleteRemovesDefinition() throws IOException {
        Path file = dir.resolve("definitions.yml");
        YamlDefinitionStore store = new YamlDefinitionStore(file);
        store.save(definition("alpha", ServerKind.PAPER));
        store.save(definition("beta", ServerKind.PAPER));

        store.delete("alpha");

        assertThat(new YamlDefinitionStore(file).loadAll()).extracting(ServerDefinition::getId).containsExactly("beta");
    }

    @Test
    void returnedDefinitionsAreCopies() throws IOException {
        YamlDefinitionStore store = new YamlDefinitionStore(dir.resolve("definitions.yml"));
        store.save(definition("alpha", ServerKind.PAPER));

        store.find("alpha").orElseThrow().setName("changed");

        assertThat(store.find("alpha").orElseThrow().getName()).isEqualTo("Survival alpha");
    }

    @Test
    void missingFileMeansNoDefinitions() throws IOException {
        assertThat(new YamlDefinitionStore(dir.resolve("absent.yml")).loadAll()).isEmpty();
    }

    @Test
    void malformedFileIsReportedAsIoFailure() throws IOException {
        Path file = dir.resolve("definitions.yml");
        Files.writeString(file, "servers:\n  - id: alpha\n    port: not-a-number\n");

        assertThatThrownBy(() -> new YamlDefinitionStore(file).loadAll())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Malformed definitions file");
    }
}
