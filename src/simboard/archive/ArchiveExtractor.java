package simboard.archive;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static simboard.archive.UnsafeArchiveException.Reason.PATH_TRAVERSAL;
import static simboard.archive.UnsafeArchiveException.Reason.UNSAFE_MEMBER_TYPE;

/**
 * Unpacks zip and gzipped tar archives. Every member is checked before anything is written, so an archive
 * containing a single unsafe member leaves the output directory untouched.
 */
public class ArchiveExtractor {
    private final Logger log;

    public ArchiveExtractor() {
        this(LoggerFactory.getLogger(ArchiveExtractor.class));
    }

    public ArchiveExtractor(Logger log) {
        this.log = log;
    }

    public void extract(Path archive, Path outputDir) throws IOException {
        ArchiveFormat format = ArchiveFormat.of(archive);
        Files.createDirectories(outputDir);
        Path baseDir = outputDir.toRealPath();
        switch (format) {
            case ZIP:
                extractZip(archive, baseDir);
                break;
            case TAR_GZ:
                extractTarGz(archive, baseDir);
                break;
            default:
                throw new UnsupportedArchiveFormatException(archive);
        }
        log.info("Extracted {} to {}", archive, baseDir);
    }

    private void extractZip(Path archive, Path baseDir) throws IOException {
        try (ZipFile zip = ZipFile.builder().setPath(archive).get()) {
            List<ZipArchiveEntry> entries = Collections.list(zip.getEntries());
            for (ZipArchiveEntry entry : entries) {
                if (entry.isUnixSymlink()) {
                    throw unsafeMemberType(entry.getName());
                }
                resolveMember(baseDir, entry.getName());
            }
            for (ZipArchiveEntry entry : entries) {
                Path target = resolveMember(baseDir, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    try (InputStream stream = zip.getInputStream(entry)) {
                        writeFile(stream, target);
                    }
                }
            }
        }
    }

    private void extractTarGz(Path archive, Path baseDir) throws IOException {
        List<String> names = new ArrayList<>();
        try (TarArchiveInputStream tar = openTarGz(archive)) {
            for (TarArchiveEntry entry = tar.getNextEntry(); entry != null; entry = tar.getNextEntry()) {
                if (!isRegularFileOrDirectory(entry)) {
                    throw unsafeMemberType(entry.getName());
                }
                resolveMember(baseDir, entry.getName());
                names.add(entry.getName());
            }
        }
        log.debug("Validated {} members of {}", names.size(), archive);

        try (TarArchiveInputStream tar = openTarGz(archive)) {
            for (TarArchiveEntry entry = tar.getNextEntry(); entry != null; entry = tar.getNextEntry()) {
                Path target = resolveMember(baseDir, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    writeFile(tar, target);
                }
            }
        }
    }

    private static TarArchiveInputStream openTarGz(Path archive) throws IOException {
        return new TarArchiveInputStream(new GzipCompressorInputStream(new BufferedInputStream(Files.newInputStream(archive))));
    }

    static boolean isRegularFileOrDirectory(TarArchiveEntry entry) {
        if (entry.isDirectory()) {
            return true;
        }
        if (entry.isSymbolicLink() || entry.isLink() || entry.isCharacterDevice() || entry.isBlockDevice()
                || entry.isFIFO()) {
            return false;
        }
        return entry.isFile();
    }

    /**
     * Resolves an archive member name against the extraction directory.
     *
     * @throws UnsafeArchiveException if the member would land outside the extraction directory
     */
    static Path resolveMember(Path baseDir, String name) {
        Path target = baseDir.resolve(name).normalize();
        if (!target.startsWith(baseDir)) {
            throw new UnsafeArchiveException(PATH_TRAVERSAL, name,
                    "Archive member path escapes extraction directory: " + name + " -> " + target);
        }
        return target;
    }

    private static UnsafeArchiveException unsafeMemberType(String name) {
        return new UnsafeArchiveException(UNSAFE_MEMBER_TYPE, name, "Blocked unsafe archive member type: " + name);
    }

    private static void writeFile(InputStream stream, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
    }
}
