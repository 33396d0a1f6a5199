package flowprobe.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One running (or unavailable) capture. Closing it terminates the capture process:
 * graceful terminate, bounded wait, forced kill if it does not exit, then a settle delay
 * so the trace is complete on disk.
 */
public class CaptureHandle implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(CaptureHandle.class);

    private final Path traceFile;
    private final Process process;
    private final Path errorLog;
    private final String unavailableReason;
    private final long stopTimeoutMillis;
    private final long settleMillis;
    private final AtomicBoolean closed = new AtomicBoolean();

    private CaptureHandle(Path traceFile, Process process, Path errorLog, String unavailableReason,
                          long stopTimeoutMillis, long settleMillis) {
        this.traceFile = traceFile;
        this.process = process;
        this.errorLog = errorLog;
        this.unavailableReason = unavailableReason;
        this.stopTimeoutMillis = stopTimeoutMillis;
        this.settleMillis = settleMillis;
    }

    /**
     * @param errorLog the process's stderr file, deleted on close; may be null
     */
    public static CaptureHandle running(Path traceFile, Process process, long stopTimeoutMillis,
                                        long settleMillis, Path errorLog) {
        return new CaptureHandle(traceFile, process, errorLog, null, stopTimeoutMillis, settleMillis);
    }

    public static CaptureHandle unavailable(Path traceFile, String reason) {
        return new CaptureHandle(traceFile, null, null, reason == null ? "capture unavailable" : reason, 0, 0);
    }

    public boolean isAvailable() { return process != null; }

    public String getUnavailableReason() { return unavailableReason == null ? "" : unavailableReason; }

    public Path getTraceFile() { return traceFile; }

    public boolean isClosed() { return closed.get(); }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true) || process == null) return;
        try {
            process.destroy();
            if (!process.waitFor(stopTimeoutMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("Capture process did not exit within {}ms, killing it", stopTimeoutMillis);
                process.destroyForcibly();
                process.waitFor(stopTimeoutMillis, TimeUnit.MILLISECONDS);
            }
            if (settleMillis > 0) TimeUnit.MILLISECONDS.sleep(settleMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        } finally {
            deleteErrorLog();
        }
    }

    private void deleteErrorLog() {
        if (errorLog == null) return;
        try {
            Files.deleteIfExists(errorLog);
        } catch (IOException e) {
            logger.debug("could not delete {}: {}", errorLog, e.toString());
        }
    }
}
