package simboard.ingest;

import simboard.archive.ArchiveRejectedException;

import java.nio.file.Path;
import java.util.List;

/**
 * More than one file in a directory matches the same file spec.
 */
public class AmbiguousFileMatchException extends ArchiveRejectedException {
    private final String specKey;
    private final List<Path> matches;

    public AmbiguousFileMatchException(String specKey, Path directory, List<Path> matches) {
        super("Multiple files matching " + specKey + " in " + directory + ": " + matches);
        this.specKey = specKey;
        this.matches = List.copyOf(matches);
    }

    public String getSpecKey() {
        return specKey;
    }

    public List<Path> getMatches() {
        return matches;
    }
}
