package flowprobe.experiments;

import flowprobe.common.CaptureStatus;
import flowprobe.common.TrialMetrics;

import java.util.Collections;
import java.util.List;

/**
 * Trials of one sweep, in configuration order, with success and signal counts.
 */
public final class SweepResult {
    private final List<TrialMetrics> trials;
    private final int plannedTrials;
    private final double elapsedSeconds;
    private final boolean cancelled;

    public SweepResult(List<TrialMetrics> trials, int plannedTrials, double elapsedSeconds, boolean cancelled) {
        this.trials = Collections.unmodifiableList(trials);
        this.plannedTrials = plannedTrials;
        this.elapsedSeconds = elapsedSeconds;
        this.cancelled = cancelled;
    }

    public List<TrialMetrics> getTrials() { return trials; }
    public int getPlannedTrials() { return plannedTrials; }
    public double getElapsedSeconds() { return elapsedSeconds; }
    public boolean isCancelled() { return cancelled; }

    public int total() { return trials.size(); }

    public long successes() {
        return trials.stream().filter(TrialMetrics::isSucceeded).count();
    }

    public long failures() {
        return total() - successes();
    }

    /** Successful trials that saw at least one zero-window advertisement. */
    public long withZeroWindow() {
        return trials.stream().filter(m -> m.isSucceeded() && m.getZeroWindowCount() > 0).count();
    }

    /** Successful trials whose trace could not be fully analyzed. */
    public long withIncompleteAnalysis() {
        return trials.stream().filter(m -> m.isSucceeded()
                && (m.getCaptureStatus() == CaptureStatus.PARTIAL
                    || m.getCaptureStatus() == CaptureStatus.ANALYSIS_UNAVAILABLE)).count();
    }

    /** True when every planned trial ran and succeeded. */
    public boolean allSucceeded() {
        return !cancelled && total() == plannedTrials && failures() == 0;
    }
}
