package flowprobe.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a packet trace into flow-control signals:
 *  - zero-window advertisements
 *  - advertised window series (min/max/mean/oscillations)
 *  - retransmissions and duplicate ACKs
 *
 * Every extraction degrades to "unavailable" on its own; nothing here fails a trial.
 */
public class CaptureAnalyzer {
    private static final Logger logger = LogManager.getLogger(CaptureAnalyzer.class);

    static final String ZERO_WINDOW_FILTER = "tcp.analysis.zero_window";
    static final String RETRANSMISSION_FILTER = "tcp.analysis.retransmission";
    static final String DUP_ACK_FILTER = "tcp.analysis.duplicate_ack";
    static final String TCP_FILTER = "tcp";
    static final String FRAME_NUMBER = "frame.number";
    static final String WINDOW_SIZE = "tcp.window_size";

    private final TraceQuery query;
    private final double oscillationThresholdFraction;

    public CaptureAnalyzer(TraceQuery query, double oscillationThresholdFraction) {
        this.query = query;
        this.oscillationThresholdFraction = oscillationThresholdFraction;
    }

    public CaptureAnalysis analyze(Path trace) {
        if (trace == null || !Files.isRegularFile(trace)) {
            return CaptureAnalysis.unavailable("trace file missing: " + trace);
        }
        Observation<Long> zeroWindows = count(trace, ZERO_WINDOW_FILTER);
        Observation<WindowStats> windows = query.fieldValues(trace, TCP_FILTER, WINDOW_SIZE)
                .map(lines -> WindowStats.of(parseWindows(lines), oscillationThresholdFraction));
        Observation<Long> retransmits = count(trace, RETRANSMISSION_FILTER);
        Observation<Long> dupAcks = count(trace, DUP_ACK_FILTER);

        CaptureAnalysis analysis = new CaptureAnalysis(zeroWindows, windows, retransmits, dupAcks);
        if (!analysis.isFullyAvailable()) {
            logger.debug("Partial analysis of {}: {}", trace, analysis);
        }
        return analysis;
    }

    private Observation<Long> count(Path trace, String filter) {
        return query.fieldValues(trace, filter, FRAME_NUMBER).map(lines -> (long) lines.size());
    }

    /**
     * Parses one window value per line. Lines that are not integers are skipped;
     * a line holding several comma-separated values (tunnelled packets) contributes its first.
     */
    static List<Long> parseWindows(List<String> lines) {
        List<Long> windows = new ArrayList<>(lines.size());
        for (String line : lines) {
            String v = line.trim();
            int comma = v.indexOf(',');
            if (comma >= 0) v = v.substring(0, comma).trim();
            if (v.isEmpty()) continue;
            try {
                windows.add(Long.parseLong(v));
            } catch (NumberFormatException e) {
                logger.trace("skipping window value '{}'", line);
            }
        }
        return windows;
    }
}
