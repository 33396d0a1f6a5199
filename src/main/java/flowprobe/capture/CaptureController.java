package flowprobe.capture;

import java.nio.file.Path;

/**
 * Binds packet capture to the lifetime of one trial.
 *
 * {@link #startCapture} never throws for an unavailable capture facility; it returns an
 * unavailable handle instead, and the trial carries on with degraded metrics.
 */
public interface CaptureController {

    /**
     * Starts capturing traffic on {@code port} into {@code traceFile} and returns once
     * capture has had time to settle.
     */
    CaptureHandle startCapture(int port, Path traceFile);

    /**
     * Stops capture gracefully and waits for the trace to be flushed. Idempotent.
     */
    default void stopCapture(CaptureHandle handle) {
        handle.close();
    }
}
