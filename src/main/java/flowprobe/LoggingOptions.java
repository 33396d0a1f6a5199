package flowprobe;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.LoggerConfig;
import picocli.CommandLine;

/**
 * Verbosity flags shared by every subcommand.
 */
public class LoggingOptions {

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Debug output")
    boolean verbose;

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Warnings and errors only")
    boolean quiet;

    public void apply() {
        if (verbose) {
            setRootLevel(Level.DEBUG);
        } else if (quiet) {
            setRootLevel(Level.WARN);
        }
    }

    private static void setRootLevel(Level level) {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        LoggerConfig rootConfig = context.getConfiguration().getRootLogger();
        rootConfig.setLevel(level);
        context.updateLoggers();
    }
}
