package simboard.archive;

import java.nio.file.Path;

public class UnsupportedArchiveFormatException extends ArchiveRejectedException {

    public UnsupportedArchiveFormatException(Path archive) {
        super("Unsupported archive format: " + archive);
    }
}
