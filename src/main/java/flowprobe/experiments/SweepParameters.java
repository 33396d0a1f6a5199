package flowprobe.experiments;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * POJO holding the parameter ranges of a sweep, read from JSON.
 *
 * Example JSON fields:
 * {
 *   "name": "quick",
 *   "recvBufs": [8192, 32768],
 *   "delaysMs": [25, 100],
 *   "readSizes": [4096],
 *   "sendRatesMbps": [0.25, 1.0],
 *   "durationSec": 5.0
 * }
 *
 * The "default" and "quick" presets ship as classpath resources under presets/.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SweepParameters {
    public static final String DEFAULT_PRESET = "default";
    public static final String QUICK_PRESET = "quick";

    public String name = "custom";
    public List<Integer> recvBufs = new ArrayList<>();
    public List<Double> delaysMs = new ArrayList<>();
    public List<Integer> readSizes = new ArrayList<>();
    public List<Double> sendRatesMbps = new ArrayList<>();
    public double durationSec = 10.0;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static SweepParameters preset(String presetName) throws IOException {
        String resource = "/presets/" + presetName + ".json";
        try (InputStream in = SweepParameters.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("unknown preset '" + presetName + "' (expected "
                        + DEFAULT_PRESET + " or " + QUICK_PRESET + ")");
            }
            return MAPPER.readValue(in, SweepParameters.class);
        }
    }

    public static SweepParameters defaults() throws IOException {
        return preset(DEFAULT_PRESET);
    }

    public static SweepParameters quick() throws IOException {
        return preset(QUICK_PRESET);
    }

    public static SweepParameters load(File f) throws IOException {
        return MAPPER.readValue(f, SweepParameters.class);
    }

    /** Number of trials the cross-product of these ranges produces. */
    public int size() {
        return recvBufs.size() * delaysMs.size() * readSizes.size() * sendRatesMbps.size();
    }

    /**
     * Rough wall-clock estimate for the whole sweep: one extra second per trial
     * for setup, teardown and the inter-trial pause.
     */
    public double estimatedSeconds() {
        return size() * (durationSec + 1.0);
    }

    public void validate() {
        requireNonEmpty("recvBufs", recvBufs);
        requireNonEmpty("delaysMs", delaysMs);
        requireNonEmpty("readSizes", readSizes);
        requireNonEmpty("sendRatesMbps", sendRatesMbps);
        if (!(durationSec > 0)) throw new IllegalArgumentException("durationSec must be > 0: " + durationSec);
    }

    private static void requireNonEmpty(String field, List<?> values) {
        if (values == null || values.isEmpty()) throw new IllegalArgumentException(field + " must not be empty");
        if (values.contains(null)) throw new IllegalArgumentException(field + " contains a null value");
    }
}
