package flowprobe.capture;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs a display-filter query over a packet trace and returns one field value per
 * matching packet.
 */
public interface TraceQuery {

    Observation<List<String>> fieldValues(Path trace, String displayFilter, String field);
}
