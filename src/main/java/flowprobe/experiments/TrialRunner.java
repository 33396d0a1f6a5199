package flowprobe.experiments;

import flowprobe.capture.CaptureAnalysis;
import flowprobe.capture.CaptureAnalyzer;
import flowprobe.capture.CaptureController;
import flowprobe.capture.CaptureHandle;
import flowprobe.capture.TcpdumpCaptureController;
import flowprobe.capture.TsharkTraceQuery;
import flowprobe.capture.WindowStats;
import flowprobe.common.CaptureStatus;
import flowprobe.common.HarnessSettings;
import flowprobe.common.TrialConfig;
import flowprobe.common.TrialMetrics;
import flowprobe.tcp.RateLimitedSender;
import flowprobe.tcp.SendResult;
import flowprobe.tcp.ThrottledReceiver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

/**
 * Runs one trial end to end:
 *  - PREPARING: allocate the trace file
 *  - CAPTURING: start capture, start the receiver and wait until it listens
 *  - TRANSFERRING: run the sender for the trial duration (receiver reads concurrently)
 *  - drain, stop receiver, stop capture (in that order, so teardown packets are captured)
 *  - ANALYZING: extract flow-control signals, delete the trace
 *  - RECORDED: metrics complete
 *
 * Any exception moves the trial to FAILED. A metrics record is returned either way.
 * Receiver, capture process and trace file are released on every path.
 */
public class TrialRunner {
    private static final Logger logger = LogManager.getLogger(TrialRunner.class);

    private final HarnessSettings settings;
    private final CaptureController captureController;
    private final CaptureAnalyzer analyzer;

    private volatile TrialState state;
    private volatile RateLimitedSender activeSender;
    private volatile boolean cancelled;

    public TrialRunner(HarnessSettings settings) {
        this(settings, new TcpdumpCaptureController(settings),
                new CaptureAnalyzer(new TsharkTraceQuery(settings.analysisCommand, settings.analysisTimeoutMillis),
                        settings.oscillationThresholdFraction));
    }

    public TrialRunner(HarnessSettings settings, CaptureController captureController, CaptureAnalyzer analyzer) {
        this.settings = settings;
        this.captureController = captureController;
        this.analyzer = analyzer;
    }

    public TrialMetrics run(TrialConfig config) {
        TrialMetrics metrics = new TrialMetrics(config, LocalDateTime.now().toString());
        Path trace = null;
        CaptureHandle capture = null;
        ThrottledReceiver receiver = null;
        try {
            enter(TrialState.PREPARING);
            if (settings.captureEnabled) {
                trace = Files.createTempFile("flowprobe-trial-", ".pcap");
            }

            enter(TrialState.CAPTURING);
            if (trace != null) {
                capture = captureController.startCapture(settings.port, trace);
                metrics.setCaptureStatus(capture.isAvailable() ? CaptureStatus.CAPTURED : CaptureStatus.UNAVAILABLE);
            } else {
                metrics.setCaptureStatus(CaptureStatus.DISABLED);
            }
            receiver = newReceiver(config);
            receiver.start(settings.receiverReadyTimeoutMillis);

            enter(TrialState.TRANSFERRING);
            RateLimitedSender sender = new RateLimitedSender(settings.host, settings.port, config,
                    settings.sendChunkBytes, settings.blockThresholdMillis);
            activeSender = sender;
            if (cancelled) sender.requestStop();
            long t0 = System.nanoTime();
            SendResult sent = sender.run();
            double actualSeconds = (System.nanoTime() - t0) / 1_000_000_000.0;
            activeSender = null;

            sleepQuietly(settings.drainMillis);
            receiver.stop(settings.receiverStopTimeoutMillis);
            if (capture != null) captureController.stopCapture(capture);

            metrics.recordTransfer(sent.getBytesSent(), actualSeconds);
            metrics.recordSenderBlocking(sent.getBlockCount(), sent.getBlockedMillis());
            metrics.recordReceiver(receiver.getBytesRead(), receiver.getEffectiveReceiveBufferBytes());
            if (!sent.isConnected()) {
                throw new IOException(sent.getError());
            }
            if (!sent.getError().isEmpty()) {
                logger.debug("Transfer ended early ({}), keeping partial metrics", sent.getError());
            }

            enter(TrialState.ANALYZING);
            if (capture != null && capture.isAvailable()) {
                apply(analyzer.analyze(trace), metrics);
            }

            if (cancelled) {
                metrics.fail("cancelled");
                enter(TrialState.FAILED);
            } else {
                metrics.succeed();
                enter(TrialState.RECORDED);
            }
        } catch (IOException | RuntimeException e) {
            enter(TrialState.FAILED);
            metrics.fail(describe(e));
            logger.debug("Trial failed: {}", config, e);
        } finally {
            activeSender = null;
            if (receiver != null) receiver.stop(settings.receiverStopTimeoutMillis);
            if (capture != null) captureController.stopCapture(capture);
            deleteTrace(trace);
            metrics.freeze();
        }
        return metrics;
    }

    /** Receiver for one trial; bound to the harness port. */
    protected ThrottledReceiver newReceiver(TrialConfig config) {
        long acceptTimeoutMillis = (long) (config.getDurationSeconds() * 1000) + settings.acceptGraceMillis;
        return new ThrottledReceiver(settings.port, config, acceptTimeoutMillis);
    }

    private void apply(CaptureAnalysis analysis, TrialMetrics metrics) {
        metrics.recordZeroWindows(analysis.getZeroWindows().orElse(0L), settings.zeroWindowEventMillis);
        WindowStats w = analysis.getWindows().orElse(WindowStats.EMPTY);
        metrics.recordWindow(w.getMin(), w.getMax(), w.getMean(), w.getOscillations(), w.getPackets());
        metrics.recordRetransmits(analysis.getRetransmits().orElse(0L));
        metrics.recordDupAcks(analysis.getDupAcks().orElse(0L));
        if (!analysis.isFullyAvailable()) {
            metrics.setCaptureStatus(analysis.isAnyAvailable()
                    ? CaptureStatus.PARTIAL : CaptureStatus.ANALYSIS_UNAVAILABLE);
            logger.warn("Trace analysis incomplete, missing signals recorded as 0: {}", analysis);
        }
    }

    /**
     * Stops the current transfer promptly; the trial still runs its normal teardown
     * and is recorded as failed with detail "cancelled".
     */
    public void cancel() {
        cancelled = true;
        RateLimitedSender sender = activeSender;
        if (sender != null) sender.requestStop();
    }

    public boolean isCancelled() { return cancelled; }

    /** Stage of the most recent (or current) trial; null before the first one. */
    public TrialState getState() { return state; }

    private void enter(TrialState next) {
        logger.trace("{} -> {}", state, next);
        state = next;
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }

    private static void sleepQuietly(long millis) {
        if (millis <= 0) return;
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void deleteTrace(Path trace) {
        if (trace == null) return;
        try {
            Files.deleteIfExists(trace);
        } catch (IOException e) {
            logger.warn("Could not delete trace {}: {}", trace, e.toString());
        }
    }
}
