package flowprobe.experiments;

import flowprobe.common.TrialConfig;
import flowprobe.common.TrialMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultsWriterTest {

    @TempDir
    Path dir;

    @Test
    void headerListsEveryField() throws Exception {
        Path out = dir.resolve("results.csv");
        try (ResultsWriter writer = ResultsWriter.create(out)) {
            assertThat(writer.getRows()).isZero();
        }

        List<String> lines = Files.readAllLines(out);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).isEqualTo(String.join(",", TrialMetrics.FIELD_NAMES));
    }

    @Test
    void rowsAreVisibleBeforeClose() throws Exception {
        Path out = dir.resolve("nested/dir/results.csv");
        try (ResultsWriter writer = ResultsWriter.create(out)) {
            TrialMetrics m = new TrialMetrics(new TrialConfig(4096, 10, 2048, 0.1, 1), "t");
            m.succeed();
            writer.append(m);

            List<String> lines = Files.readAllLines(out);
            assertThat(lines).hasSize(2);
            assertThat(lines.get(1)).startsWith("4096,10,2048,0.1,1,");
            assertThat(writer.getRows()).isEqualTo(1);
        }
    }

    @Test
    void errorDetailWithCommasIsQuoted() throws Exception {
        Path out = dir.resolve("results.csv");
        try (ResultsWriter writer = ResultsWriter.create(out)) {
            TrialMetrics m = new TrialMetrics(new TrialConfig(4096, 10, 2048, 0.1, 1), "t");
            m.fail("connect failed: refused, \"twice\"");
            writer.append(m);
        }

        assertThat(Files.readAllLines(out).get(1)).contains("\"connect failed: refused, \"\"twice\"\"\"");
    }

    @Test
    void escapesOnlyWhenNeeded() {
        assertThat(ResultsWriter.escape("plain")).isEqualTo("plain");
        assertThat(ResultsWriter.escape("a,b")).isEqualTo("\"a,b\"");
        assertThat(ResultsWriter.escape(null)).isEmpty();
    }
}
