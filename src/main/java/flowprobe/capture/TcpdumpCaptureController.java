package flowprobe.capture;

import flowprobe.common.HarnessSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Captures with an external tcpdump process (or whatever command the settings name),
 * filtered to the trial port on the loopback interface. Keeping capture out of process
 * keeps its privilege requirements away from the trial logic.
 */
public class TcpdumpCaptureController implements CaptureController {
    private static final Logger logger = LogManager.getLogger(TcpdumpCaptureController.class);

    private final List<String> commandTemplate;
    private final String captureInterface;
    private final long settleMillis;
    private final long stopTimeoutMillis;

    public TcpdumpCaptureController(HarnessSettings settings) {
        this(settings.captureCommand, settings.captureInterface,
                settings.captureSettleMillis, settings.captureStopTimeoutMillis);
    }

    public TcpdumpCaptureController(List<String> commandTemplate, String captureInterface,
                                    long settleMillis, long stopTimeoutMillis) {
        this.commandTemplate = List.copyOf(commandTemplate);
        this.captureInterface = captureInterface;
        this.settleMillis = settleMillis;
        this.stopTimeoutMillis = stopTimeoutMillis;
    }

    List<String> commandLine(int port, Path traceFile) {
        List<String> cmd = new ArrayList<>(commandTemplate.size());
        for (String part : commandTemplate) {
            cmd.add(part.replace("{iface}", captureInterface)
                    .replace("{file}", traceFile.toString())
                    .replace("{port}", Integer.toString(port)));
        }
        return cmd;
    }

    @Override
    public CaptureHandle startCapture(int port, Path traceFile) {
        List<String> cmd = commandLine(port, traceFile);
        Path errLog = traceFile.resolveSibling(traceFile.getFileName() + ".err");
        Process process;
        try {
            process = new ProcessBuilder(cmd)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(errLog.toFile())
                    .start();
        } catch (IOException e) {
            deleteQuietly(errLog);
            logger.warn("Capture unavailable, cannot launch {}: {}", cmd.get(0), e.getMessage());
            return CaptureHandle.unavailable(traceFile, "cannot launch " + cmd.get(0) + ": " + e.getMessage());
        }

        try {
            if (settleMillis > 0) TimeUnit.MILLISECONDS.sleep(settleMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (!process.isAlive()) {
            String detail = cmd.get(0) + " exited with status " + process.exitValue() + lastLine(errLog);
            deleteQuietly(errLog);
            logger.warn("Capture unavailable: {}", detail);
            return CaptureHandle.unavailable(traceFile, detail);
        }
        logger.debug("Capture started: {}", String.join(" ", cmd));
        return CaptureHandle.running(traceFile, process, stopTimeoutMillis, settleMillis, errLog);
    }

    private static String lastLine(Path file) {
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            for (int i = lines.size() - 1; i >= 0; i--) {
                if (!lines.get(i).isBlank()) return ": " + lines.get(i).trim();
            }
        } catch (IOException e) {
            logger.debug("no capture error output: {}", e.toString());
        }
        return "";
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("could not delete {}: {}", file, e.toString());
        }
    }
}
