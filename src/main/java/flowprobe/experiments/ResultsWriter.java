package flowprobe.experiments;

import flowprobe.common.TrialMetrics;

import java.io.Closeable;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Append-only CSV result store. The header lists every {@link TrialMetrics} field;
 * each trial is one row written and flushed as soon as the trial is done.
 */
public class ResultsWriter implements Closeable {
    private final Path path;
    private final PrintWriter pw;
    private int rows;

    private ResultsWriter(Path path, PrintWriter pw) {
        this.path = path;
        this.pw = pw;
    }

    /**
     * Creates (or truncates) the store and writes the header row.
     */
    public static ResultsWriter create(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        PrintWriter pw = new PrintWriter(new FileWriter(path.toFile(), StandardCharsets.UTF_8, false));
        ResultsWriter writer = new ResultsWriter(path, pw);
        writer.writeLine(TrialMetrics.FIELD_NAMES);
        return writer;
    }

    /**
     * Appends one record in a single write followed by a flush.
     *
     * @throws IOException if the row could not be written; the store is no longer trustworthy
     */
    public synchronized void append(TrialMetrics metrics) throws IOException {
        writeLine(metrics.toRow());
        rows++;
    }

    private void writeLine(List<String> values) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escape(values.get(i)));
        }
        sb.append('\n');
        pw.print(sb);
        pw.flush();
        if (pw.checkError()) {
            throw new IOException("failed writing results to " + path);
        }
    }

    static String escape(String value) {
        if (value == null) return "";
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    public Path getPath() { return path; }

    public synchronized int getRows() { return rows; }

    @Override
    public synchronized void close() {
        pw.close();
    }
}
