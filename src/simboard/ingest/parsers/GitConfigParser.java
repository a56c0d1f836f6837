package simboard.ingest.parsers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the url of the origin remote from a saved .git/config.
 */
public class GitConfigParser implements ValueParser {
    private static final Pattern ORIGIN_SECTION = Pattern.compile("\\[remote \"origin\"\\]");
    private static final Pattern URL = Pattern.compile("url\\s*=\\s*(.+)");

    @Override
    public String parse(Path path) throws IOException {
        return parseLines(TextFiles.readLines(path));
    }

    String parseLines(List<String> lines) {
        boolean inOrigin = false;
        for (String line : lines) {
            String stripped = line.strip();
            if (ORIGIN_SECTION.matcher(stripped).lookingAt()) {
                inOrigin = true;
                continue;
            }
            if (!inOrigin) {
                continue;
            }
            Matcher m = URL.matcher(stripped);
            if (m.lookingAt()) {
                return m.group(1).strip();
            }
            if (stripped.startsWith("[")) {
                break;
            }
        }
        return null;
    }
}
