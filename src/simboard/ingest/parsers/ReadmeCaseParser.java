package simboard.ingest.parsers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses README.case, which starts with the create_newcase command used to set up the case.
 */
public class ReadmeCaseParser implements MetadataParser {
    private static final Pattern TIMESTAMP = Pattern.compile("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}");

    @Override
    public Map<String, String> parse(Path path) throws IOException {
        return parseLines(TextFiles.readLines(path));
    }

    Map<String, String> parseLines(List<String> lines) {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("creation_date", extractTimestamp(lines));
        result.put("grid_name", extractFlagValue(lines, "--res"));
        result.put("compset", extractFlagValue(lines, "--compset"));
        return result;
    }

    private static String extractTimestamp(List<String> lines) {
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            Matcher m = TIMESTAMP.matcher(line);
            return m.lookingAt() ? m.group() : null;
        }
        return null;
    }

    /**
     * Finds a flag on the create_newcase line, accepting both "--flag value" and "--flag=value".
     */
    static String extractFlagValue(List<String> lines, String flag) {
        for (String line : lines) {
            if (!line.contains("create_newcase")) {
                continue;
            }
            String[] parts = line.strip().split("\\s+");
            for (int i = 0; i < parts.length; i++) {
                if (parts[i].equals(flag)) {
                    if (i + 1 < parts.length) {
                        return parts[i + 1];
                    }
                } else if (parts[i].startsWith(flag + "=")) {
                    return parts[i].substring(flag.length() + 1);
                }
            }
        }
        return null;
    }
}
