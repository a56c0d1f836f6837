package simboard.archive;

/**
 * An archive that cannot be ingested at all. Raised before any experiment is processed.
 */
public class ArchiveRejectedException extends RuntimeException {

    public ArchiveRejectedException(String message) {
        super(message);
    }

    public ArchiveRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
