package simboard.ingest;

import simboard.ingest.parsers.MetadataParser;
import simboard.ingest.parsers.ValueParser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Describes one metadata file expected in an experiment directory: how to find it, whether the run is
 * incomplete without it and which parser turns it into fields.
 */
public class FileSpec {
    public enum Location {
        /** directly inside the experiment directory */
        ROOT,
        /** inside a child directory whose name starts with the spec's subdirectory prefix */
        NESTED
    }

    private final String key;
    private final Pattern pattern;
    private final Location location;
    private final String subdirPrefix;
    private final MetadataParser parser;
    private final String singleValueField;
    private final boolean required;
    private final Set<String> ownedFields;

    private FileSpec(String key, Pattern pattern, Location location, String subdirPrefix, MetadataParser parser,
                     String singleValueField, boolean required) {
        this(key, pattern, location, subdirPrefix, parser, singleValueField, required, Set.of());
    }

    private FileSpec(String key, Pattern pattern, Location location, String subdirPrefix, MetadataParser parser,
                     String singleValueField, boolean required, Set<String> ownedFields) {
        this.key = Objects.requireNonNull(key);
        this.pattern = Objects.requireNonNull(pattern);
        this.location = Objects.requireNonNull(location);
        this.subdirPrefix = subdirPrefix;
        this.parser = Objects.requireNonNull(parser);
        this.singleValueField = singleValueField;
        this.required = required;
        this.ownedFields = Set.copyOf(ownedFields);
        if (location == Location.NESTED && (subdirPrefix == null || subdirPrefix.isEmpty())) {
            throw new IllegalArgumentException("nested file spec " + key + " needs a subdirectory prefix");
        }
    }

    public static FileSpec root(String key, String regex, MetadataParser parser, boolean required) {
        return new FileSpec(key, Pattern.compile(regex), Location.ROOT, null, parser, null, required);
    }

    public static FileSpec nested(String key, String regex, String subdirPrefix, MetadataParser parser, boolean required) {
        return new FileSpec(key, Pattern.compile(regex), Location.NESTED, subdirPrefix, parser, null, required);
    }

    /**
     * A root level file whose parser yields a single value, stored under {@code field}.
     */
    public static FileSpec rootValue(String key, String regex, ValueParser parser, String field, boolean required) {
        return new FileSpec(key, Pattern.compile(regex), Location.ROOT, null, singleValue(parser, field), field, required);
    }

    /**
     * A copy of this spec that is the sole source of the given fields. Whatever its parser reports for them,
     * including a missing value, replaces what earlier files reported.
     */
    public FileSpec owning(String... fields) {
        return new FileSpec(key, pattern, location, subdirPrefix, parser, singleValueField, required, Set.of(fields));
    }

    private static MetadataParser singleValue(ValueParser parser, String field) {
        Objects.requireNonNull(field);
        return (Path path) -> {
            Map<String, String> fields = new HashMap<>();
            fields.put(field, parser.parse(path));
            return fields;
        };
    }

    /**
     * Whether a filename matches this spec. Matching is anchored at the start of the name only.
     */
    public boolean matches(String filename) {
        return pattern.matcher(filename).lookingAt();
    }

    public Map<String, String> parse(Path path) throws IOException {
        return parser.parse(path);
    }

    public String getKey() {
        return key;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Location getLocation() {
        return location;
    }

    public String getSubdirPrefix() {
        return subdirPrefix;
    }

    public String getSingleValueField() {
        return singleValueField;
    }

    public boolean isRequired() {
        return required;
    }

    public Set<String> getOwnedFields() {
        return ownedFields;
    }

    @Override
    public String toString() {
        return key + " (" + pattern.pattern() + ")";
    }
}
