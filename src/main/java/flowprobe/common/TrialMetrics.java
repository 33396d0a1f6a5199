package flowprobe.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Per-trial metrics record.
 * - Echoes the originating {@link TrialConfig} plus its derived capacity and ratio
 * - Transfer measurements from the sender and receiver
 * - Flow-control signals from capture analysis
 * - Success flag and error detail
 *
 * Populated by the trial runner, then frozen before it is appended to the result store.
 * Any mutation after {@link #freeze()} throws {@link IllegalStateException}.
 */
public class TrialMetrics {

    /** Column order of the result store. */
    public static final List<String> FIELD_NAMES = Collections.unmodifiableList(Arrays.asList(
            "receiveBufferBytes",
            "readDelayMillis",
            "readChunkBytes",
            "targetSendRateMbps",
            "durationSeconds",
            "receiverCapacityBytesPerSec",
            "oversubscriptionRatio",
            "actualDurationSeconds",
            "bytesTransferred",
            "actualThroughputKBps",
            "zeroWindowCount",
            "zeroWindowDurationEstimateMs",
            "windowMin",
            "windowMax",
            "windowMean",
            "windowOscillationCount",
            "totalPacketsObserved",
            "retransmitCount",
            "dupAckCount",
            "succeeded",
            "errorDetail",
            "timestamp",
            "zeroWindowPct",
            "senderBlockCount",
            "senderBlockedMs",
            "bytesReceived",
            "effectiveReceiveBufferBytes",
            "captureStatus"
    ));

    private final TrialConfig config;
    private final double receiverCapacityBytesPerSec;
    private final double oversubscriptionRatio;
    private final String timestamp;

    private double actualDurationSeconds;
    private long bytesTransferred;
    private double actualThroughputKBps;

    private long zeroWindowCount;
    private double zeroWindowDurationEstimateMs;
    private double zeroWindowPct;
    private long windowMin;
    private long windowMax;
    private double windowMean;
    private long windowOscillationCount;
    private long totalPacketsObserved;
    private long retransmitCount;
    private long dupAckCount;

    private long senderBlockCount;
    private double senderBlockedMs;
    private long bytesReceived;
    private int effectiveReceiveBufferBytes;
    private CaptureStatus captureStatus = CaptureStatus.DISABLED;

    private boolean succeeded;
    private String errorDetail = "";

    private volatile boolean frozen;

    public TrialMetrics(TrialConfig config, String timestamp) {
        this.config = config;
        this.receiverCapacityBytesPerSec = config.receiverCapacityBytesPerSec();
        this.oversubscriptionRatio = config.oversubscriptionRatio();
        this.timestamp = timestamp == null ? "" : timestamp;
    }

    public void freeze() { frozen = true; }
    public boolean isFrozen() { return frozen; }

    private void checkMutable() {
        if (frozen) throw new IllegalStateException("metrics already reported for " + config);
    }

    /**
     * Marks the trial failed. The error detail is never left empty on a failure.
     */
    public void fail(String detail) {
        checkMutable();
        this.succeeded = false;
        this.errorDetail = detail == null || detail.isBlank() ? "unknown error" : detail;
    }

    public void succeed() {
        checkMutable();
        this.succeeded = true;
        this.errorDetail = "";
    }

    /**
     * Records transfer results and derives throughput in KB/s (1 KB = 1024 bytes).
     */
    public void recordTransfer(long bytesSent, double actualDurationSeconds) {
        checkMutable();
        this.bytesTransferred = bytesSent;
        this.actualDurationSeconds = actualDurationSeconds;
        this.actualThroughputKBps = actualDurationSeconds > 0 ? (bytesSent / actualDurationSeconds) / 1024.0 : 0.0;
    }

    public void recordSenderBlocking(long blockCount, double blockedMs) {
        checkMutable();
        this.senderBlockCount = blockCount;
        this.senderBlockedMs = blockedMs;
    }

    public void recordReceiver(long bytesReceived, int effectiveReceiveBufferBytes) {
        checkMutable();
        this.bytesReceived = bytesReceived;
        this.effectiveReceiveBufferBytes = effectiveReceiveBufferBytes;
    }

    public void setCaptureStatus(CaptureStatus captureStatus) {
        checkMutable();
        this.captureStatus = captureStatus;
    }

    /**
     * Records the zero-window count together with its duration estimate.
     * The estimate is {@code count * eventMillis}; it is a fixed per-event heuristic,
     * not a reconstruction of the actual zero-window timeline.
     */
    public void recordZeroWindows(long count, double eventMillis) {
        checkMutable();
        this.zeroWindowCount = count;
        this.zeroWindowDurationEstimateMs = count * eventMillis;
        this.zeroWindowPct = actualDurationSeconds > 0
                ? (zeroWindowDurationEstimateMs / 1000.0) / actualDurationSeconds * 100.0
                : 0.0;
    }

    public void recordWindow(long min, long max, double mean, long oscillations, long packets) {
        checkMutable();
        this.windowMin = min;
        this.windowMax = max;
        this.windowMean = mean;
        this.windowOscillationCount = oscillations;
        this.totalPacketsObserved = packets;
    }

    public void recordRetransmits(long retransmits) {
        checkMutable();
        this.retransmitCount = retransmits;
    }

    public void recordDupAcks(long dupAcks) {
        checkMutable();
        this.dupAckCount = dupAcks;
    }

    public TrialConfig getConfig() { return config; }
    public double getReceiverCapacityBytesPerSec() { return receiverCapacityBytesPerSec; }
    public double getOversubscriptionRatio() { return oversubscriptionRatio; }
    public String getTimestamp() { return timestamp; }
    public double getActualDurationSeconds() { return actualDurationSeconds; }
    public long getBytesTransferred() { return bytesTransferred; }
    public double getActualThroughputKBps() { return actualThroughputKBps; }
    public long getZeroWindowCount() { return zeroWindowCount; }
    public double getZeroWindowDurationEstimateMs() { return zeroWindowDurationEstimateMs; }
    public double getZeroWindowPct() { return zeroWindowPct; }
    public long getWindowMin() { return windowMin; }
    public long getWindowMax() { return windowMax; }
    public double getWindowMean() { return windowMean; }
    public long getWindowOscillationCount() { return windowOscillationCount; }
    public long getTotalPacketsObserved() { return totalPacketsObserved; }
    public long getRetransmitCount() { return retransmitCount; }
    public long getDupAckCount() { return dupAckCount; }
    public long getSenderBlockCount() { return senderBlockCount; }
    public double getSenderBlockedMs() { return senderBlockedMs; }
    public long getBytesReceived() { return bytesReceived; }
    public int getEffectiveReceiveBufferBytes() { return effectiveReceiveBufferBytes; }
    public CaptureStatus getCaptureStatus() { return captureStatus; }
    public boolean isSucceeded() { return succeeded; }
    public String getErrorDetail() { return errorDetail; }

    /**
     * Values in {@link #FIELD_NAMES} order, unescaped.
     */
    public List<String> toRow() {
        List<String> row = new ArrayList<>(FIELD_NAMES.size());
        row.add(Integer.toString(config.getReceiveBufferBytes()));
        row.add(Units.formatNumber(config.getReadDelayMillis()));
        row.add(Integer.toString(config.getReadChunkBytes()));
        row.add(Units.formatNumber(config.getTargetSendRateMbps()));
        row.add(Units.formatNumber(config.getDurationSeconds()));
        row.add(Units.formatNumber(receiverCapacityBytesPerSec));
        row.add(Units.formatNumber(oversubscriptionRatio));
        row.add(Units.formatNumber(actualDurationSeconds));
        row.add(Long.toString(bytesTransferred));
        row.add(Units.formatNumber(actualThroughputKBps));
        row.add(Long.toString(zeroWindowCount));
        row.add(Units.formatNumber(zeroWindowDurationEstimateMs));
        row.add(Long.toString(windowMin));
        row.add(Long.toString(windowMax));
        row.add(Units.formatNumber(windowMean));
        row.add(Long.toString(windowOscillationCount));
        row.add(Long.toString(totalPacketsObserved));
        row.add(Long.toString(retransmitCount));
        row.add(Long.toString(dupAckCount));
        row.add(Boolean.toString(succeeded));
        row.add(errorDetail);
        row.add(timestamp);
        row.add(Units.formatNumber(zeroWindowPct));
        row.add(Long.toString(senderBlockCount));
        row.add(Units.formatNumber(senderBlockedMs));
        row.add(Long.toString(bytesReceived));
        row.add(Integer.toString(effectiveReceiveBufferBytes));
        row.add(captureStatus.name());
        return row;
    }
}
