package flowprobe.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TrialMetricsTest {

    private final TrialConfig config = new TrialConfig(8192, 100, 1024, 1.0, 5);

    @Test
    void echoesConfigurationAndDerivedValues() {
        TrialMetrics m = new TrialMetrics(config, "2026-01-01T00:00");

        assertThat(m.getConfig()).isSameAs(config);
        assertThat(m.getReceiverCapacityBytesPerSec()).isCloseTo(10240.0, within(1e-9));
        assertThat(m.getOversubscriptionRatio()).isCloseTo(102.4, within(1e-9));
        assertThat(m.isSucceeded()).isFalse();
        assertThat(m.getErrorDetail()).isEmpty();
        assertThat(m.getCaptureStatus()).isEqualTo(CaptureStatus.DISABLED);
    }

    @Test
    void throughputIsKilobytesPerSecond() {
        TrialMetrics m = new TrialMetrics(config, "");
        m.recordTransfer(2 * 1024 * 1024, 4.0);

        assertThat(m.getActualThroughputKBps()).isCloseTo(512.0, within(1e-9));
    }

    @Test
    void zeroWindowDurationIsFixedPerEventEstimate() {
        TrialMetrics m = new TrialMetrics(config, "");
        m.recordTransfer(1000, 5.0);
        m.recordZeroWindows(42, 10.0);

        assertThat(m.getZeroWindowCount()).isEqualTo(42);
        assertThat(m.getZeroWindowDurationEstimateMs()).isEqualTo(420.0);
        assertThat(m.getZeroWindowPct()).isCloseTo(8.4, within(1e-9));
    }

    @Test
    void failureAlwaysCarriesDetail() {
        TrialMetrics m = new TrialMetrics(config, "");
        m.fail("  ");

        assertThat(m.isSucceeded()).isFalse();
        assertThat(m.getErrorDetail()).isNotBlank();
    }

    @Test
    void frozenMetricsRejectChanges() {
        TrialMetrics m = new TrialMetrics(config, "");
        m.succeed();
        m.freeze();

        assertThat(m.isFrozen()).isTrue();
        assertThatThrownBy(() -> m.recordRetransmits(3)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> m.fail("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rowMatchesHeader() {
        TrialMetrics m = new TrialMetrics(new TrialConfig(65536, 0, 8192, 0.5, 5), "ts");
        m.recordTransfer(100, 1.0);
        m.succeed();

        assertThat(m.toRow()).hasSameSizeAs(TrialMetrics.FIELD_NAMES);
        assertThat(m.toRow().get(TrialMetrics.FIELD_NAMES.indexOf("receiverCapacityBytesPerSec"))).isEqualTo("inf");
        assertThat(m.toRow().get(TrialMetrics.FIELD_NAMES.indexOf("succeeded"))).isEqualTo("true");
        assertThat(m.toRow().get(TrialMetrics.FIELD_NAMES.indexOf("captureStatus"))).isEqualTo("DISABLED");
    }
}
