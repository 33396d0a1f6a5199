package flowprobe.experiments;

/**
 * Stages of one trial. {@link #FAILED} is reachable from every stage before RECORDED.
 */
public enum TrialState {
    PREPARING,
    CAPTURING,
    TRANSFERRING,
    ANALYZING,
    RECORDED,
    FAILED
}
