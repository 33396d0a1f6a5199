package flowprobe.common;

import java.util.Objects;

/**
 * One point in the sweep's configuration space. Immutable.
 *
 * Rates are expressed in "MB/s" the way the sweep has always reported them:
 * 1 MB/s = 1024 * 1024 bytes per second.
 */
public final class TrialConfig {
    public static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final int receiveBufferBytes;
    private final double readDelayMillis;
    private final int readChunkBytes;
    private final double targetSendRateMbps;
    private final double durationSeconds;

    public TrialConfig(int receiveBufferBytes, double readDelayMillis, int readChunkBytes,
                       double targetSendRateMbps, double durationSeconds) {
        if (receiveBufferBytes < 0) throw new IllegalArgumentException("receiveBufferBytes must be >= 0: " + receiveBufferBytes);
        if (readDelayMillis < 0 || Double.isNaN(readDelayMillis)) throw new IllegalArgumentException("readDelayMillis must be >= 0: " + readDelayMillis);
        if (readChunkBytes < 0) throw new IllegalArgumentException("readChunkBytes must be >= 0: " + readChunkBytes);
        if (targetSendRateMbps < 0 || Double.isNaN(targetSendRateMbps)) throw new IllegalArgumentException("targetSendRateMbps must be >= 0: " + targetSendRateMbps);
        if (!(durationSeconds > 0)) throw new IllegalArgumentException("durationSeconds must be > 0: " + durationSeconds);
        this.receiveBufferBytes = receiveBufferBytes;
        this.readDelayMillis = readDelayMillis;
        this.readChunkBytes = readChunkBytes;
        this.targetSendRateMbps = targetSendRateMbps;
        this.durationSeconds = durationSeconds;
    }

    public int getReceiveBufferBytes() { return receiveBufferBytes; }
    public double getReadDelayMillis() { return readDelayMillis; }
    public int getReadChunkBytes() { return readChunkBytes; }
    public double getTargetSendRateMbps() { return targetSendRateMbps; }
    public double getDurationSeconds() { return durationSeconds; }

    /**
     * Theoretical maximum consumption rate of the throttled receiver.
     * A zero read delay means the receiver is not throttled at all, reported as
     * {@link Double#POSITIVE_INFINITY}.
     */
    public double receiverCapacityBytesPerSec() {
        if (readDelayMillis <= 0) return Double.POSITIVE_INFINITY;
        return readChunkBytes / (readDelayMillis / 1000.0);
    }

    public double targetSendRateBytesPerSec() {
        return targetSendRateMbps * BYTES_PER_MB;
    }

    /**
     * Offered rate over receiver capacity. Zero when the receiver is unbounded,
     * infinite when the receiver can consume nothing (zero read size) but the sender offers load.
     */
    public double oversubscriptionRatio() {
        double capacity = receiverCapacityBytesPerSec();
        double offered = targetSendRateBytesPerSec();
        if (capacity == 0) return offered > 0 ? Double.POSITIVE_INFINITY : 0.0;
        return offered / capacity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrialConfig)) return false;
        TrialConfig that = (TrialConfig) o;
        return receiveBufferBytes == that.receiveBufferBytes
                && Double.compare(readDelayMillis, that.readDelayMillis) == 0
                && readChunkBytes == that.readChunkBytes
                && Double.compare(targetSendRateMbps, that.targetSendRateMbps) == 0
                && Double.compare(durationSeconds, that.durationSeconds) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(receiveBufferBytes, readDelayMillis, readChunkBytes, targetSendRateMbps, durationSeconds);
    }

    @Override
    public String toString() {
        return String.format("buf=%s, delay=%sms, read=%s, rate=%sMB/s (oversub=%.1fx)",
                Units.formatBytes(receiveBufferBytes), Units.formatNumber(readDelayMillis),
                Units.formatBytes(readChunkBytes), Units.formatNumber(targetSendRateMbps),
                oversubscriptionRatio());
    }
}
