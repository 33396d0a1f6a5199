package flowprobe.experiments;

import flowprobe.common.HarnessSettings;
import flowprobe.common.TrialConfig;
import flowprobe.common.TrialMetrics;
import flowprobe.common.Units;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs trials one after another over a list of configurations.
 * For each configuration:
 *  - logs progress
 *  - runs the trial (a failed trial is still a record)
 *  - appends the record to the result store and flushes it
 *  - pauses briefly before the next trial
 *
 * Only a result-store failure ends the sweep early with an exception.
 */
public class SweepController {
    private static final Logger logger = LogManager.getLogger(SweepController.class);

    private final TrialRunner runner;
    private final long interTrialPauseMillis;
    private volatile boolean cancelled;

    public SweepController(TrialRunner runner, HarnessSettings settings) {
        this(runner, settings.interTrialPauseMillis);
    }

    public SweepController(TrialRunner runner, long interTrialPauseMillis) {
        this.runner = runner;
        this.interTrialPauseMillis = interTrialPauseMillis;
    }

    /**
     * @throws IOException if the result store cannot be created or written
     */
    public SweepResult run(List<TrialConfig> configs, Path output) throws IOException {
        List<TrialMetrics> results = new ArrayList<>(configs.size());
        long start = System.nanoTime();
        try (ResultsWriter writer = ResultsWriter.create(output)) {
            for (int i = 0; i < configs.size(); i++) {
                if (cancelled) {
                    logger.warn("Sweep cancelled, {} of {} trials not run", configs.size() - i, configs.size());
                    break;
                }
                TrialConfig config = configs.get(i);
                logger.info("[{}/{}] Running: {}", i + 1, configs.size(), config);

                TrialMetrics metrics = runTrial(config);
                writer.append(metrics);
                results.add(metrics);
                logOutcome(metrics);

                if (i < configs.size() - 1 && !cancelled) pause();
            }
        }
        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
        return new SweepResult(results, configs.size(), elapsed, cancelled);
    }

    private TrialMetrics runTrial(TrialConfig config) {
        try {
            return runner.run(config);
        } catch (RuntimeException e) {
            logger.error("Trial runner raised for {}", config, e);
            TrialMetrics failed = new TrialMetrics(config, LocalDateTime.now().toString());
            failed.fail(e.toString());
            failed.freeze();
            return failed;
        }
    }

    private void logOutcome(TrialMetrics m) {
        if (m.isSucceeded()) {
            logger.info("  -> zero_window={}, throughput={}KB/s, oscillations={}, blocks={}",
                    m.getZeroWindowCount(), String.format("%.0f", m.getActualThroughputKBps()),
                    m.getWindowOscillationCount(), m.getSenderBlockCount());
        } else {
            logger.warn("  -> FAILED: {}", m.getErrorDetail());
        }
    }

    private void pause() {
        if (interTrialPauseMillis <= 0) return;
        try {
            TimeUnit.MILLISECONDS.sleep(interTrialPauseMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
    }

    /**
     * No further trial starts; the running one stops its transfer and tears down normally.
     */
    public void cancel() {
        cancelled = true;
        runner.cancel();
    }

    public boolean isCancelled() { return cancelled; }

    public static void logBanner(SweepParameters params, int configCount, Path output) {
        logger.info("TCP Flow Control Parameter Sweep");
        logger.info("================================");
        logger.info("Configurations: {}", configCount);
        logger.info("Duration per experiment: {}s", Units.formatNumber(params.durationSec));
        logger.info("Estimated total time: {}s", String.format("%.0f", params.estimatedSeconds()));
        logger.info("Output: {}", output);
        logger.info("Parameters:");
        logger.info("  Receive buffers: {}", Units.formatBytesList(params.recvBufs));
        logger.info("  Delays: {} ms", params.delaysMs);
        logger.info("  Read sizes: {}", Units.formatBytesList(params.readSizes));
        logger.info("  Send rates: {} MB/s", params.sendRatesMbps);
    }

    public static void logSummary(SweepResult result, Path output) {
        logger.info("================================");
        logger.info("Sweep Complete{}", result.isCancelled() ? " (cancelled)" : "");
        logger.info("================================");
        logger.info("Total time: {}s", String.format("%.0f", result.getElapsedSeconds()));
        logger.info("Trials run: {}/{}", result.total(), result.getPlannedTrials());
        logger.info("Successful: {}/{}", result.successes(), result.total());
        logger.info("With zero-window events: {}/{}", result.withZeroWindow(), result.successes());
        if (result.withIncompleteAnalysis() > 0) {
            logger.warn("Trace analysis incomplete: {}/{} (their zero counts are not measurements)",
                    result.withIncompleteAnalysis(), result.successes());
        }
        logger.info("Results saved to: {}", output);
    }
}
