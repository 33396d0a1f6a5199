package flowprobe.capture;

import java.util.List;

/**
 * Summary of the advertised window series of a trace.
 *
 * An oscillation is a consecutive change whose magnitude exceeds
 * {@code thresholdFraction * max}. It is a coarse instability signal, nothing more.
 */
public final class WindowStats {
    public static final WindowStats EMPTY = new WindowStats(0, 0, 0.0, 0, 0);

    private final long min;
    private final long max;
    private final double mean;
    private final long oscillations;
    private final long packets;

    WindowStats(long min, long max, double mean, long oscillations, long packets) {
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.oscillations = oscillations;
        this.packets = packets;
    }

    public static WindowStats of(List<Long> windows, double thresholdFraction) {
        if (windows.isEmpty()) return EMPTY;
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        double sum = 0;
        for (long w : windows) {
            min = Math.min(min, w);
            max = Math.max(max, w);
            sum += w;
        }
        double threshold = max * thresholdFraction;
        long oscillations = 0;
        for (int i = 1; i < windows.size(); i++) {
            if (Math.abs(windows.get(i) - windows.get(i - 1)) > threshold) oscillations++;
        }
        return new WindowStats(min, max, sum / windows.size(), oscillations, windows.size());
    }

    public long getMin() { return min; }
    public long getMax() { return max; }
    public double getMean() { return mean; }
    public long getOscillations() { return oscillations; }
    public long getPackets() { return packets; }

    @Override
    public String toString() {
        return "WindowStats{min=" + min + ", max=" + max + ", mean=" + mean
                + ", oscillations=" + oscillations + ", packets=" + packets + "}";
    }
}
