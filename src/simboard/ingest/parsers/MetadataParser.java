package simboard.ingest.parsers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Converts one metadata file into a flat set of fields. Absent data is represented by null values.
 */
@FunctionalInterface
public interface MetadataParser {
    Map<String, String> parse(Path path) throws IOException;
}
