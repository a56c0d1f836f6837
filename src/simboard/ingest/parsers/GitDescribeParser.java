package simboard.ingest.parsers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the output of {@code git describe} saved as GIT_DESCRIBE, e.g. {@code v3.0.0-1234-gea457362f3}.
 */
public class GitDescribeParser implements MetadataParser {
    static final Pattern VERSION_DESCRIBE = Pattern.compile(
            "^(?<tag>v?\\d+(?:\\.\\d+)*(?:[-.][0-9A-Za-z]+)*)-g(?<hash>[0-9a-fA-F]+)$");
    private static final Pattern TRAILING_HASH = Pattern.compile("-g([0-9a-fA-F]+)$");

    @Override
    public Map<String, String> parse(Path path) throws IOException {
        return parseLines(TextFiles.readLines(path));
    }

    Map<String, String> parseLines(List<String> lines) {
        String describe = null;
        for (String line : lines) {
            if (!line.isBlank()) {
                describe = line.strip();
                break;
            }
        }

        String tag = null;
        String hash = null;
        if (describe != null) {
            Matcher m = VERSION_DESCRIBE.matcher(describe);
            if (m.matches()) {
                tag = m.group("tag");
                hash = m.group("hash");
            } else {
                int dash = describe.indexOf('-');
                tag = dash > 0 ? describe.substring(0, dash) : (dash < 0 ? describe : null);
                Matcher trailing = TRAILING_HASH.matcher(describe);
                if (trailing.find()) {
                    hash = trailing.group(1);
                }
            }
        }

        Map<String, String> result = new LinkedHashMap<>();
        result.put("git_tag", tag);
        result.put("git_commit_hash", hash);
        return result;
    }
}
