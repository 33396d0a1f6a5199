package flowprobe;

import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Entry point.
 *
 * Examples:
 *   mvn exec:java -Dexec.args="sweep --quick --output results_quick.csv"
 *   mvn exec:java -Dexec.args="sweep --recv-bufs 4096 8192 --delays 10 50 --rates 0.5 1.0 -o custom.csv"
 *   mvn exec:java -Dexec.args="trial --recv-buf 8192 --delay 100 --read-size 1024 --rate 1.0 --duration 5"
 */
@CommandLine.Command(name = "flowprobe",
    mixinStandardHelpOptions = true,
    version = "flowprobe 1.0",
    description = "Characterize TCP flow-control behavior (zero windows, window oscillation, retransmits) "
        + "across receive buffer, read delay, read size and send rate.",
    subcommands = {SweepCommand.class, TrialCommand.class, CommandLine.HelpCommand.class})
public class AppLauncher implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AppLauncher()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return 1;
    }
}
