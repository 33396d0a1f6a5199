package flowprobe.common;

/**
 * What happened to packet capture for one trial.
 */
public enum CaptureStatus {
    /** Capture was switched off for the sweep. */
    DISABLED,
    /** Capture was requested but the capture facility could not be started. */
    UNAVAILABLE,
    /** A trace was written and every flow-control signal was extracted from it. */
    CAPTURED,
    /**
     * A trace was written but some signals could not be extracted. Their columns hold 0,
     * which here means "not measured", not "none observed".
     */
    PARTIAL,
    /** A trace was written but no signal could be extracted (analysis tool missing or failing). */
    ANALYSIS_UNAVAILABLE
}
