package flowprobe.experiments;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SweepParametersTest {

    @Test
    void defaultPreset() throws Exception {
        SweepParameters p = SweepParameters.defaults();

        assertThat(p.name).isEqualTo("default");
        assertThat(p.recvBufs).containsExactly(4096, 8192, 16384, 32768, 65536);
        assertThat(p.delaysMs).containsExactly(10.0, 25.0, 50.0, 100.0, 200.0);
        assertThat(p.readSizes).containsExactly(2048, 4096, 8192);
        assertThat(p.sendRatesMbps).containsExactly(0.1, 0.25, 0.5, 1.0, 2.0);
        assertThat(p.durationSec).isEqualTo(10.0);
        assertThat(p.size()).isEqualTo(375);
        assertThat(p.estimatedSeconds()).isEqualTo(375 * 11.0);
    }

    @Test
    void quickPresetIsSmallerAndShorter() throws Exception {
        SweepParameters quick = SweepParameters.quick();

        assertThat(quick.size()).isEqualTo(8);
        assertThat(quick.durationSec).isLessThan(SweepParameters.defaults().durationSec);
    }

    @Test
    void unknownPresetIsRejected() {
        assertThatThrownBy(() -> SweepParameters.preset("huge"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("huge");
    }

    @Test
    void loadsJsonFileIgnoringUnknownFields() throws Exception {
        File f = new File(Objects.requireNonNull(getClass().getResource("/custom-params.json")).toURI());

        SweepParameters p = SweepParameters.load(f);

        assertThat(p.name).isEqualTo("custom");
        assertThat(p.delaysMs).containsExactly(0.0, 50.0);
        assertThat(p.durationSec).isEqualTo(2.5);
        assertThat(p.size()).isEqualTo(4);
    }
}
