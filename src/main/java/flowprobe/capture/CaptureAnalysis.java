package flowprobe.capture;

/**
 * Flow-control signals extracted from one trial's trace. Each signal is independent:
 * one unavailable query does not affect the others.
 */
public final class CaptureAnalysis {
    private final Observation<Long> zeroWindows;
    private final Observation<WindowStats> windows;
    private final Observation<Long> retransmits;
    private final Observation<Long> dupAcks;

    public CaptureAnalysis(Observation<Long> zeroWindows, Observation<WindowStats> windows,
                           Observation<Long> retransmits, Observation<Long> dupAcks) {
        this.zeroWindows = zeroWindows;
        this.windows = windows;
        this.retransmits = retransmits;
        this.dupAcks = dupAcks;
    }

    public static CaptureAnalysis unavailable(String reason) {
        return new CaptureAnalysis(Observation.unavailable(reason), Observation.unavailable(reason),
                Observation.unavailable(reason), Observation.unavailable(reason));
    }

    public Observation<Long> getZeroWindows() { return zeroWindows; }
    public Observation<WindowStats> getWindows() { return windows; }
    public Observation<Long> getRetransmits() { return retransmits; }
    public Observation<Long> getDupAcks() { return dupAcks; }

    public boolean isFullyAvailable() {
        return zeroWindows.isAvailable() && windows.isAvailable()
                && retransmits.isAvailable() && dupAcks.isAvailable();
    }

    public boolean isAnyAvailable() {
        return zeroWindows.isAvailable() || windows.isAvailable()
                || retransmits.isAvailable() || dupAcks.isAvailable();
    }

    @Override
    public String toString() {
        return "CaptureAnalysis{zeroWindows=" + zeroWindows + ", windows=" + windows
                + ", retransmits=" + retransmits + ", dupAcks=" + dupAcks + "}";
    }
}
