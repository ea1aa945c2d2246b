package me.internalizable.craftkeeper.supervisor.metrics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessHandleResourceProbeTest {

    @TempDir
    Path procRoot;

    @Test
    void readsResidentMemoryFromStatusFile() throws IOException {
        Path pidDir = Files.createDirectories(procRoot.resolve("4321"));
        Files.writeString(pidDir.resolve("status"), String.join("\n",
                "Name:\tjava",
                "VmPeak:\t 9000000 kB",
                "VmRSS:\t 2097152 kB",
                "Threads:\t64",
                ""));

        ProcessHandleResourceProbe probe = new ProcessHandleResourceProbe(procRoot);

        assertThat(probe.readResidentMemory(4321)).isEqualTo(2048L * 1024 * 1024);
    }

    @Test
    void missingStatusFileMeansUnknownMemory() {
        assertThat(new ProcessHandleResourceProbe(procRoot).readResidentMemory(99)).isZero();
    }

    @Test
    void unknownPidYieldsNoSample() {
        assertThat(new ProcessHandleResourceProbe(procRoot).sample(Long.MAX_VALUE)).isEmpty();
    }

    @Test
    void currentProcessCanBeSampled() {
        ProcessHandleResourceProbe probe = new ProcessHandleResourceProbe(procRoot);
        long pid = ProcessHandle.current().pid();

        probe.sample(pid);

        assertThat(probe.sample(pid)).hasValueSatisfying(usage -> assertThat(usage.cpuPercent()).isNotNegative());
    }
}
