package simboard.ingest;

import simboard.archive.ArchiveRejectedException;

import java.nio.file.Path;

public class NoExperimentsFoundException extends ArchiveRejectedException {
    public NoExperimentsFoundException(Path rootDir) {
        super("No experiment directories found in " + rootDir);
    }
}
