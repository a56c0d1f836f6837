package simboard.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the parsers over an experiment's located files and merges their output into {@link SimulationMetadata}.
 */
public class MetadataAssembler {
    private final Logger log;
    private final List<FileSpec> fileSpecs;

    public MetadataAssembler(List<FileSpec> fileSpecs) {
        this(fileSpecs, LoggerFactory.getLogger(MetadataAssembler.class));
    }

    public MetadataAssembler(List<FileSpec> fileSpecs, Logger log) {
        this.fileSpecs = List.copyOf(fileSpecs);
        this.log = log;
    }

    public SimulationMetadata assemble(Path experimentDir, Map<String, Path> files) throws IOException {
        Map<String, String> parsed = new HashMap<>();
        for (FileSpec spec : fileSpecs) {
            Path path = files.get(spec.getKey());
            if (path == null) {
                continue;
            }
            log.debug("Parsing {} as {}", path, spec.getKey());
            merge(parsed, spec.parse(path), spec.getOwnedFields());
        }
        return new SimulationMetadata(experimentDir, populate(parsed));
    }

    /**
     * Copies the non-null values of {@code source} into {@code target}. A value found by an earlier parser is
     * never erased by a later parser that didn't find it, unless the later parser owns the field.
     */
    static void merge(Map<String, String> target, Map<String, String> source, Set<String> ownedFields) {
        for (Map.Entry<String, String> entry : source.entrySet()) {
            if (entry.getValue() != null) {
                target.put(entry.getKey(), entry.getValue());
            }
        }
        for (String field : ownedFields) {
            target.put(field, source.get(field));
        }
    }

    private static Map<String, String> populate(Map<String, String> parsed) {
        Map<String, String> fields = new HashMap<>();
        for (String field : SimulationMetadata.FIELDS) {
            fields.put(field, parsed.get(field));
        }
        String user = parsed.get("user");
        fields.put("name", parsed.get("case_name"));
        fields.put("hpc_username", user);
        fields.put("created_by", user);
        fields.put("last_updated_by", user);

        // never sourced from the archive
        fields.put("parent_simulation_id", null);
        fields.put("simulation_type", null);
        fields.put("extra", null);
        fields.put("artifacts", null);
        fields.put("links", null);
        return fields;
    }
}
