package simboard.ingest.parsers;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts a single value from a metadata file, or null if the file doesn't contain it.
 */
@FunctionalInterface
public interface ValueParser {
    String parse(Path path) throws IOException;
}
