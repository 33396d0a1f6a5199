package flowprobe.common;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Harness tunables shared by every trial of a sweep. Read from JSON with Jackson;
 * every field has a working default so an empty object is a valid settings file.
 *
 * Example JSON:
 * {
 *   "port": 9999,
 *   "captureInterface": "lo",
 *   "oscillationThresholdFraction": 0.2,
 *   "zeroWindowEventMillis": 10
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HarnessSettings {
    public String host = "127.0.0.1";
    public int port = 9999;

    // sender
    public int sendChunkBytes = 8192;
    public long blockThresholdMillis = 100;

    // receiver
    public long receiverReadyTimeoutMillis = 2000;
    public long receiverStopTimeoutMillis = 2000;
    /** Extra time the receiver waits for a connection on top of the trial duration. */
    public long acceptGraceMillis = 5000;

    // trial sequencing
    public long drainMillis = 200;
    public long interTrialPauseMillis = 500;

    // capture
    public boolean captureEnabled = true;
    public String captureInterface = "lo";
    /** Placeholders: {iface}, {file}, {port}. */
    public List<String> captureCommand = new ArrayList<>(Arrays.asList(
            "tcpdump", "-i", "{iface}", "-w", "{file}", "port", "{port}"));
    public long captureSettleMillis = 300;
    public long captureStopTimeoutMillis = 2000;

    // analysis
    public String analysisCommand = "tshark";
    public long analysisTimeoutMillis = 30_000;
    /** Consecutive window change above this fraction of the observed maximum counts as an oscillation. */
    public double oscillationThresholdFraction = 0.2;
    /** Fixed per-event duration used to estimate total zero-window time. */
    public double zeroWindowEventMillis = 10.0;

    public static HarnessSettings load(File f) throws IOException {
        HarnessSettings settings = new ObjectMapper().readValue(f, HarnessSettings.class);
        settings.validate();
        return settings;
    }

    public void validate() {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (sendChunkBytes <= 0) throw new IllegalArgumentException("sendChunkBytes must be > 0: " + sendChunkBytes);
        if (blockThresholdMillis < 0) throw new IllegalArgumentException("blockThresholdMillis must be >= 0");
        if (oscillationThresholdFraction < 0) throw new IllegalArgumentException("oscillationThresholdFraction must be >= 0");
        if (zeroWindowEventMillis < 0) throw new IllegalArgumentException("zeroWindowEventMillis must be >= 0");
        if (captureCommand == null || captureCommand.isEmpty()) throw new IllegalArgumentException("captureCommand is empty");
    }
}
