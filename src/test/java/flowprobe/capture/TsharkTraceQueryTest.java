package flowprobe.capture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TsharkTraceQueryTest {

    @TempDir
    Path dir;

    private Path nonEmptyTrace() throws Exception {
        Path trace = dir.resolve("trial.pcap");
        Files.write(trace, new byte[]{0x0a, 0x0d, 0x0d, 0x0a});
        return trace;
    }

    @Test
    void buildsFieldQuery() {
        Path trace = dir.resolve("trial.pcap");

        assertThat(new TsharkTraceQuery("tshark", 1000).commandLine(trace, "tcp", "tcp.window_size"))
                .containsExactly("tshark", "-r", trace.toString(), "-Y", "tcp", "-T", "fields", "-e", "tcp.window_size");
    }

    @Test
    void emptyTraceIsUnavailable() throws Exception {
        Path trace = Files.createFile(dir.resolve("empty.pcap"));

        Observation<List<String>> result = new TsharkTraceQuery("tshark", 1000).fieldValues(trace, "tcp", "frame.number");

        assertThat(result.isAvailable()).isFalse();
    }

    @Test
    void missingToolIsUnavailable() throws Exception {
        Observation<List<String>> result = new TsharkTraceQuery("flowprobe-no-such-tshark", 1000)
                .fieldValues(nonEmptyTrace(), "tcp", "frame.number");

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.reason()).contains("cannot run");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitIsUnavailable() throws Exception {
        Observation<List<String>> result = new TsharkTraceQuery("false", 1000)
                .fieldValues(nonEmptyTrace(), "tcp", "frame.number");

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.reason()).contains("exited with status");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void returnsNonBlankOutputLines() throws Exception {
        // echo prints its arguments back on one line
        Observation<List<String>> result = new TsharkTraceQuery("echo", 1000)
                .fieldValues(nonEmptyTrace(), "tcp", "frame.number");

        assertThat(result.isAvailable()).isTrue();
        assertThat(result.get()).hasSize(1);
        assertThat(result.get().get(0)).startsWith("-r ").endsWith("-e frame.number");
    }
}
