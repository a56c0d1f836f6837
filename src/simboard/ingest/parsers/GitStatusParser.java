package simboard.ingest.parsers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the checked out branch from a saved {@code git status}.
 */
public class GitStatusParser implements ValueParser {
    private static final Pattern ON_BRANCH = Pattern.compile("On branch (.+)");

    @Override
    public String parse(Path path) throws IOException {
        return parseLines(TextFiles.readLines(path));
    }

    String parseLines(List<String> lines) {
        for (String line : lines) {
            Matcher m = ON_BRANCH.matcher(line.strip());
            if (m.lookingAt()) {
                return m.group(1).strip();
            }
        }
        return null;
    }
}
