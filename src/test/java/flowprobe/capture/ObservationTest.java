package flowprobe.capture;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObservationTest {

    @Test
    void availableZeroIsNotUnavailable() {
        Observation<Long> zero = Observation.available(0L);
        Observation<Long> missing = Observation.unavailable("no tool");

        assertThat(zero.isAvailable()).isTrue();
        assertThat(zero.get()).isZero();
        assertThat(missing.isAvailable()).isFalse();
        assertThat(missing.orElse(0L)).isZero();
        assertThat(missing.reason()).isEqualTo("no tool");
    }

    @Test
    void mapKeepsUnavailableReason() {
        Observation<Integer> mapped = Observation.<String>unavailable("timed out").map(String::length);

        assertThat(mapped.isAvailable()).isFalse();
        assertThat(mapped.reason()).isEqualTo("timed out");
        assertThat(Observation.available("abc").map(String::length).get()).isEqualTo(3);
    }

    @Test
    void getOnUnavailableThrows() {
        assertThatThrownBy(() -> Observation.unavailable("x").get()).isInstanceOf(IllegalStateException.class);
    }
}
