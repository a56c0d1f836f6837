package simboard.ingest;

import java.nio.file.Path;
import java.util.List;

/**
 * An experiment directory lacks one or more required files, meaning the run never completed.
 */
public class MissingRequiredFilesException extends RuntimeException {
    private final Path experimentDir;
    private final List<String> missingKeys;

    public MissingRequiredFilesException(Path experimentDir, List<String> missingKeys) {
        super("Required files missing in experiment directory " + experimentDir + ": " + String.join(", ", missingKeys));
        this.experimentDir = experimentDir;
        this.missingKeys = List.copyOf(missingKeys);
    }

    public Path getExperimentDir() {
        return experimentDir;
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
