package simboard.ingest.parsers;

import org.apache.commons.io.IOUtils;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads plain or gzip compressed text files. Bytes that are not valid UTF-8 are replaced rather than rejected.
 */
public class TextFiles {
    private TextFiles() {}

    public static InputStream open(Path path) throws IOException {
        InputStream stream = new BufferedInputStream(Files.newInputStream(path));
        if (path.getFileName().toString().endsWith(".gz")) {
            try {
                return new GZIPInputStream(stream);
            } catch (IOException e) {
                stream.close();
                throw e;
            }
        }
        return stream;
    }

    public static String read(Path path) throws IOException {
        try (InputStream stream = open(path)) {
            return IOUtils.toString(stream, UTF_8);
        }
    }

    public static List<String> readLines(Path path) throws IOException {
        return read(path).lines().collect(Collectors.toList());
    }
}
