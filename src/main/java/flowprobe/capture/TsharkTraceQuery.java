package flowprobe.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * {@link TraceQuery} backed by the tshark command line:
 * {@code tshark -r <trace> -Y <filter> -T fields -e <field>}.
 *
 * Output goes to a temporary file so a large result cannot stall the process on a full pipe.
 */
public class TsharkTraceQuery implements TraceQuery {
    private static final Logger logger = LogManager.getLogger(TsharkTraceQuery.class);

    private final String command;
    private final long timeoutMillis;

    public TsharkTraceQuery(String command, long timeoutMillis) {
        this.command = command;
        this.timeoutMillis = timeoutMillis;
    }

    List<String> commandLine(Path trace, String displayFilter, String field) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("-r");
        cmd.add(trace.toString());
        cmd.add("-Y");
        cmd.add(displayFilter);
        cmd.add("-T");
        cmd.add("fields");
        cmd.add("-e");
        cmd.add(field);
        return cmd;
    }

    @Override
    public Observation<List<String>> fieldValues(Path trace, String displayFilter, String field) {
        try {
            if (!Files.isRegularFile(trace) || Files.size(trace) == 0) {
                return Observation.unavailable("trace missing or empty: " + trace);
            }
        } catch (IOException e) {
            return Observation.unavailable("cannot stat trace: " + e.getMessage());
        }

        Path out = null;
        Process p = null;
        try {
            out = Files.createTempFile("flowprobe-query", ".txt");
            p = new ProcessBuilder(commandLine(trace, displayFilter, field))
                    .redirectOutput(out.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!p.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                return Observation.unavailable(command + " timed out after " + timeoutMillis + "ms on " + displayFilter);
            }
            if (p.exitValue() != 0) {
                return Observation.unavailable(command + " exited with status " + p.exitValue() + " on " + displayFilter);
            }
            List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(l -> !l.isEmpty())
                    .collect(Collectors.toList());
            return Observation.available(lines);
        } catch (IOException e) {
            return Observation.unavailable("cannot run " + command + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (p != null) p.destroyForcibly();
            return Observation.unavailable("interrupted while running " + command);
        } finally {
            if (out != null) {
                try {
                    Files.deleteIfExists(out);
                } catch (IOException e) {
                    logger.debug("could not delete {}: {}", out, e.toString());
                }
            }
        }
    }
}
