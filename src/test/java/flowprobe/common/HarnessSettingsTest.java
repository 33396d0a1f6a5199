package flowprobe.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HarnessSettingsTest {

    @Test
    void defaultsMatchHarnessConstants() {
        HarnessSettings s = new HarnessSettings();

        assertThat(s.port).isEqualTo(9999);
        assertThat(s.sendChunkBytes).isEqualTo(8192);
        assertThat(s.blockThresholdMillis).isEqualTo(100);
        assertThat(s.oscillationThresholdFraction).isEqualTo(0.2);
        assertThat(s.zeroWindowEventMillis).isEqualTo(10.0);
        assertThat(s.captureCommand).containsExactly("tcpdump", "-i", "{iface}", "-w", "{file}", "port", "{port}");
    }

    @Test
    void loadsPartialJsonOverDefaults(@TempDir Path dir) throws Exception {
        File f = dir.resolve("settings.json").toFile();
        Files.writeString(f.toPath(), "{\"port\": 12345, \"zeroWindowEventMillis\": 5, \"unknown\": true}");

        HarnessSettings s = HarnessSettings.load(f);

        assertThat(s.port).isEqualTo(12345);
        assertThat(s.zeroWindowEventMillis).isEqualTo(5.0);
        assertThat(s.sendChunkBytes).isEqualTo(8192);
    }

    @Test
    void rejectsInvalidValues() {
        HarnessSettings s = new HarnessSettings();
        s.sendChunkBytes = 0;

        assertThatThrownBy(s::validate).isInstanceOf(IllegalArgumentException.class);
    }
}
