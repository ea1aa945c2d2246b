package me.internalizable.craftkeeper.api.supervisor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServerStateTest {

    @Test
    void startAcceptedOnlyWhenDown() {
        assertThat(ServerState.STOPPED.canStart()).isTrue();
        assertThat(ServerState.CRASHED.canStart()).isTrue();
        assertThat(ServerState.RUNNING.canStart()).isFalse();
        assertThat(ServerState.STOPPING.canStart()).isFalse();
    }

    @Test
    void stopAcceptedOnlyWhenUp() {
        assertThat(ServerState.STARTING.canStop()).isTrue();
        assertThat(ServerState.RUNNING.canStop()).isTrue();
        assertThat(ServerState.STOPPING.canStop()).isFalse();
        assertThat(ServerState.CRASHED.canStop()).isFalse();
    }

    @Test
    void processExpectedWhileStartingRunningOrStopping() {
        assertThat(ServerState.STOPPING.isProcessExpected()).isTrue();
        assertThat(ServerState.CRASHED.isProcessExpected()).isFalse();
        assertThat(ServerState.RUNNING.getId()).isEqualTo("running");
    }
}
