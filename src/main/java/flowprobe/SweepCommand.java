package flowprobe;

import flowprobe.common.HarnessSettings;
import flowprobe.common.TrialConfig;
import flowprobe.experiments.ConfigurationSpace;
import flowprobe.experiments.SweepController;
import flowprobe.experiments.SweepParameters;
import flowprobe.experiments.SweepResult;
import flowprobe.experiments.TrialRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a parameter sweep and writes one CSV row per trial.
 * Exit status: 0 all trials succeeded, 1 some trial failed or the sweep was cancelled,
 * 2 the results could not be written or the input was invalid.
 */
@CommandLine.Command(name = "sweep",
    mixinStandardHelpOptions = true,
    description = "Run the flow-control parameter sweep (default preset: 375 trials, --quick: 8 trials).")
public class SweepCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(SweepCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    LoggingOptions logging = new LoggingOptions();

    @CommandLine.Option(names = {"--output", "-o"}, defaultValue = "sweep_results.csv",
        description = "Output CSV file (default: ${DEFAULT-VALUE})")
    Path output;

    @CommandLine.Option(names = "--quick", description = "Reduced sweep for fast validation")
    boolean quick;

    @CommandLine.Option(names = "--params", description = "JSON file with parameter ranges (replaces the preset)")
    File paramsFile;

    @CommandLine.Option(names = "--settings", description = "JSON file with harness settings")
    File settingsFile;

    @CommandLine.Option(names = "--recv-bufs", arity = "1..*", description = "Receive buffer sizes (bytes)")
    List<Integer> recvBufs;

    @CommandLine.Option(names = "--delays", arity = "1..*", description = "Read delays (ms)")
    List<Double> delays;

    @CommandLine.Option(names = "--read-sizes", arity = "1..*", description = "Read chunk sizes (bytes)")
    List<Integer> readSizes;

    @CommandLine.Option(names = "--rates", arity = "1..*", description = "Send rates (MB/s)")
    List<Double> rates;

    @CommandLine.Option(names = "--duration", description = "Duration per trial (seconds)")
    Double duration;

    @CommandLine.Option(names = "--no-pcap", description = "Skip packet capture (faster, no flow-control metrics)")
    boolean noPcap;

    @CommandLine.Option(names = "--port", description = "Trial TCP port")
    Integer port;

    @Override
    public Integer call() {
        logging.apply();

        HarnessSettings settings;
        SweepParameters params;
        List<TrialConfig> configs;
        try {
            settings = settingsFile != null ? HarnessSettings.load(settingsFile) : new HarnessSettings();
            if (noPcap) settings.captureEnabled = false;
            if (port != null) settings.port = port;
            settings.validate();
            params = resolveParameters();
            configs = ConfigurationSpace.generate(params);
        } catch (IOException e) {
            logger.error("Cannot read configuration: {}", e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }

        SweepController.logBanner(params, configs.size(), output);

        SweepController controller = new SweepController(new TrialRunner(settings), settings);
        CountDownLatch done = new CountDownLatch(1);
        AtomicInteger exitCode = new AtomicInteger(1);
        long hookWaitMillis = (long) (params.durationSec * 1000) + 10_000;
        Thread hook = new Thread(() -> {
            if (done.getCount() == 0) return;
            logger.warn("Interrupted, finishing the current trial and stopping");
            controller.cancel();
            try {
                if (done.await(hookWaitMillis, TimeUnit.MILLISECONDS)) {
                    // the JVM would otherwise exit with the signal's status
                    Runtime.getRuntime().halt(exitCode.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sweep-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            return runAndReport(controller, configs, exitCode, done);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                logger.debug("shutdown already in progress");
            }
        }
    }

    /**
     * Runs the sweep and logs its summary, then publishes the exit status and releases
     * {@code done}. A shutdown hook waiting on {@code done} sees the summary already logged.
     */
    int runAndReport(SweepController controller, List<TrialConfig> configs,
                     AtomicInteger exitCode, CountDownLatch done) {
        try {
            SweepResult result = controller.run(configs, output);
            SweepController.logSummary(result, output);
            exitCode.set(result.allSucceeded() ? 0 : 1);
        } catch (IOException e) {
            logger.error("Cannot write results to {}: {}", output, e.getMessage());
            exitCode.set(2);
        } finally {
            done.countDown();
        }
        return exitCode.get();
    }

    SweepParameters resolveParameters() throws IOException {
        SweepParameters params;
        if (paramsFile != null) {
            params = SweepParameters.load(paramsFile);
        } else if (quick) {
            params = SweepParameters.quick();
        } else {
            params = SweepParameters.defaults();
        }
        if (recvBufs != null) params.recvBufs = recvBufs;
        if (delays != null) params.delaysMs = delays;
        if (readSizes != null) params.readSizes = readSizes;
        if (rates != null) params.sendRatesMbps = rates;
        if (duration != null) params.durationSec = duration;
        params.validate();
        return params;
    }
}
