package simboard.archive;

import java.nio.file.Path;
import java.util.Locale;

public enum ArchiveFormat {
    ZIP(".zip"),
    TAR_GZ(".tar.gz", ".tgz");

    private final String[] extensions;

    ArchiveFormat(String... extensions) {
        this.extensions = extensions;
    }

    /**
     * Determines the format from the file name alone.
     *
     * @throws UnsupportedArchiveFormatException if the extension is not recognised
     */
    public static ArchiveFormat of(Path archive) {
        String filename = archive.getFileName().toString().toLowerCase(Locale.ROOT);
        for (ArchiveFormat format : values()) {
            for (String extension : format.extensions) {
                if (filename.endsWith(extension)) {
                    return format;
                }
            }
        }
        throw new UnsupportedArchiveFormatException(archive);
    }
}
