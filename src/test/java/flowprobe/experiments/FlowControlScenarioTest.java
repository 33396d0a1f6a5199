package flowprobe.experiments;

import flowprobe.common.CaptureStatus;
import flowprobe.common.HarnessSettings;
import flowprobe.common.TrialConfig;
import flowprobe.common.TrialMetrics;
import flowprobe.tcp.TestPorts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end trials over loopback. The capture-dependent cases need tcpdump, tshark and
 * capture privileges; enable them with -Dflowprobe.capture=true.
 */
@Timeout(value = 60, unit = TimeUnit.SECONDS)
class FlowControlScenarioTest {

    private static HarnessSettings settings(boolean capture) {
        HarnessSettings s = new HarnessSettings();
        s.port = TestPorts.freePort();
        s.captureEnabled = capture;
        return s;
    }

    @Test
    void unthrottledReceiverKeepsUpWithHalfMegabytePerSecond() {
        TrialConfig config = new TrialConfig(65536, 0, 8192, 0.5, 3);

        TrialMetrics m = new TrialRunner(settings(false)).run(config);

        assertThat(m.isSucceeded()).isTrue();
        assertThat(m.getReceiverCapacityBytesPerSec()).isEqualTo(Double.POSITIVE_INFINITY);
        // 0.5 MB/s is 512 KB/s
        assertThat(m.getActualThroughputKBps()).isBetween(400.0, 560.0);
        assertThat(m.getSenderBlockCount()).isZero();
    }

    @Test
    void captureDisabledLeavesCaptureFieldsAtDefaults() {
        TrialMetrics m = new TrialRunner(settings(false)).run(new TrialConfig(8192, 100, 1024, 1.0, 1));

        assertThat(m.isSucceeded()).isTrue();
        assertThat(m.getCaptureStatus()).isEqualTo(CaptureStatus.DISABLED);
        assertThat(m.getZeroWindowCount()).isZero();
        assertThat(m.getWindowMax()).isZero();
        assertThat(m.getTotalPacketsObserved()).isZero();
        assertThat(m.getRetransmitCount()).isZero();
        assertThat(m.getDupAckCount()).isZero();
    }

    @Test
    @EnabledIfSystemProperty(named = "flowprobe.capture", matches = "true")
    void slowReceiverStarvesSender() {
        TrialConfig config = new TrialConfig(8192, 100, 1024, 1.0, 5);

        TrialMetrics m = new TrialRunner(settings(true)).run(config);

        assertThat(m.isSucceeded()).isTrue();
        assertThat(m.getCaptureStatus()).isEqualTo(CaptureStatus.CAPTURED);
        assertThat(m.getReceiverCapacityBytesPerSec()).isCloseTo(10240.0, within(1e-6));
        assertThat(m.getOversubscriptionRatio()).isCloseTo(102.4, within(1e-6));
        assertThat(m.getZeroWindowCount()).isPositive();
        assertThat(m.getZeroWindowDurationEstimateMs()).isEqualTo(m.getZeroWindowCount() * 10.0);
    }

    @Test
    @EnabledIfSystemProperty(named = "flowprobe.capture", matches = "true")
    void fastReceiverNeverAdvertisesZeroWindow() {
        TrialConfig config = new TrialConfig(65536, 0, 8192, 0.5, 5);

        TrialMetrics m = new TrialRunner(settings(true)).run(config);

        assertThat(m.isSucceeded()).isTrue();
        assertThat(m.getCaptureStatus()).isEqualTo(CaptureStatus.CAPTURED);
        assertThat(m.getZeroWindowCount()).isZero();
        assertThat(m.getTotalPacketsObserved()).isPositive();
        assertThat(m.getActualThroughputKBps()).isBetween(400.0, 560.0);
    }
}
