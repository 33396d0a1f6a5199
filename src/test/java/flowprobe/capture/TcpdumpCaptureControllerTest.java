package flowprobe.capture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Timeout(value = 20, unit = TimeUnit.SECONDS)
class TcpdumpCaptureControllerTest {

    @TempDir
    Path dir;

    @Test
    void expandsCommandTemplate() {
        TcpdumpCaptureController controller = new TcpdumpCaptureController(
                List.of("tcpdump", "-i", "{iface}", "-w", "{file}", "port", "{port}"), "lo", 0, 100);
        Path trace = dir.resolve("t.pcap");

        assertThat(controller.commandLine(9999, trace))
                .containsExactly("tcpdump", "-i", "lo", "-w", trace.toString(), "port", "9999");
    }

    @Test
    void missingBinaryGivesUnavailableHandle() {
        TcpdumpCaptureController controller = new TcpdumpCaptureController(
                List.of("flowprobe-no-such-capture-tool"), "lo", 0, 100);

        CaptureHandle handle = controller.startCapture(9999, dir.resolve("t.pcap"));

        assertThat(handle.isAvailable()).isFalse();
        assertThat(handle.getUnavailableReason()).contains("cannot launch");
        controller.stopCapture(handle);
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void processThatExitsDuringSettleIsUnavailable() {
        TcpdumpCaptureController controller = new TcpdumpCaptureController(
                List.of("sh", "-c", "echo 'permission denied' >&2; exit 3"), "lo", 300, 100);

        CaptureHandle handle = controller.startCapture(9999, dir.resolve("t.pcap"));

        assertThat(handle.isAvailable()).isFalse();
        assertThat(handle.getUnavailableReason()).contains("status 3").contains("permission denied");
        assertThat(dir.resolve("t.pcap.err")).doesNotExist();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void stopTerminatesRunningCapture() {
        TcpdumpCaptureController controller = new TcpdumpCaptureController(
                List.of("sleep", "30"), "lo", 100, 2000);

        CaptureHandle handle = controller.startCapture(9999, dir.resolve("t.pcap"));
        assertThat(handle.isAvailable()).isTrue();

        long t0 = System.nanoTime();
        controller.stopCapture(handle);
        controller.stopCapture(handle);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0)).isLessThan(2000);
        assertThat(handle.isClosed()).isTrue();
        assertThat(dir.resolve("t.pcap.err")).doesNotExist();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void captureIgnoringTerminateIsKilledAfterTimeout() {
        TcpdumpCaptureController controller = new TcpdumpCaptureController(
                List.of("sh", "-c", "trap '' TERM; while true; do sleep 1; done"), "lo", 100, 300);

        CaptureHandle handle = controller.startCapture(9999, dir.resolve("t.pcap"));
        assertThat(handle.isAvailable()).isTrue();

        long t0 = System.nanoTime();
        handle.close();

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0)).isLessThan(3000);
    }
}
