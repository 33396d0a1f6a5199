package flowprobe;

import flowprobe.common.HarnessSettings;
import flowprobe.common.TrialConfig;
import flowprobe.common.TrialMetrics;
import flowprobe.experiments.TrialRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs a single trial and prints its metrics, one field per line.
 */
@CommandLine.Command(name = "trial",
    mixinStandardHelpOptions = true,
    description = "Run one trial with explicit parameters.")
public class TrialCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TrialCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    LoggingOptions logging = new LoggingOptions();

    @CommandLine.Option(names = "--recv-buf", required = true, description = "Receive buffer size (bytes)")
    int recvBuf;

    @CommandLine.Option(names = "--delay", required = true, description = "Read delay (ms)")
    double delay;

    @CommandLine.Option(names = "--read-size", required = true, description = "Read chunk size (bytes)")
    int readSize;

    @CommandLine.Option(names = "--rate", required = true, description = "Send rate (MB/s)")
    double rate;

    @CommandLine.Option(names = "--duration", defaultValue = "10", description = "Duration (seconds, default: ${DEFAULT-VALUE})")
    double duration;

    @CommandLine.Option(names = "--no-pcap", description = "Skip packet capture")
    boolean noPcap;

    @CommandLine.Option(names = "--settings", description = "JSON file with harness settings")
    File settingsFile;

    @CommandLine.Option(names = "--port", description = "Trial TCP port")
    Integer port;

    @Override
    public Integer call() {
        logging.apply();
        HarnessSettings settings;
        TrialConfig config;
        try {
            settings = settingsFile != null ? HarnessSettings.load(settingsFile) : new HarnessSettings();
            if (noPcap) settings.captureEnabled = false;
            if (port != null) settings.port = port;
            settings.validate();
            config = new TrialConfig(recvBuf, delay, readSize, rate, duration);
        } catch (IOException e) {
            logger.error("Cannot read settings: {}", e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }

        logger.info("Running: {}", config);
        TrialMetrics metrics = new TrialRunner(settings).run(config);
        List<String> row = metrics.toRow();
        for (int i = 0; i < TrialMetrics.FIELD_NAMES.size(); i++) {
            System.out.println(TrialMetrics.FIELD_NAMES.get(i) + "," + row.get(i));
        }
        return metrics.isSucceeded() ? 0 : 1;
    }
}
