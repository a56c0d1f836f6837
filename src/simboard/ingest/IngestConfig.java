package simboard.ingest;

import simboard.core.Config;

import java.util.List;

/**
 * Tunables of the ingestion engine: which files to look for and which fields of later runs are compared
 * against the canonical run of their case.
 */
public class IngestConfig {
    public static final List<String> DEFAULT_DELTA_FIELDS = List.of(
            "compset",
            "compset_alias",
            "grid_name",
            "grid_resolution",
            "initialization_type",
            "compiler",
            "git_tag",
            "git_commit_hash",
            "git_branch",
            "git_repository_url",
            "campaign",
            "experiment_type",
            "group_name");

    private final List<FileSpec> fileSpecs;
    private final List<String> deltaFields;

    public IngestConfig(List<FileSpec> fileSpecs, List<String> deltaFields) {
        if (fileSpecs.isEmpty()) {
            throw new IllegalArgumentException("at least one file spec is required");
        }
        for (String field : deltaFields) {
            if (!SimulationMetadata.FIELDS.contains(field)) {
                throw new IllegalArgumentException("unknown delta field: " + field);
            }
        }
        this.fileSpecs = List.copyOf(fileSpecs);
        this.deltaFields = List.copyOf(deltaFields);
    }

    public static IngestConfig defaults() {
        return new IngestConfig(FileSpecs.defaults(), DEFAULT_DELTA_FIELDS);
    }

    public static IngestConfig from(Config config) {
        List<String> deltaFields = config.getDeltaFields();
        return new IngestConfig(FileSpecs.defaults(), deltaFields != null ? deltaFields : DEFAULT_DELTA_FIELDS);
    }

    public List<FileSpec> getFileSpecs() {
        return fileSpecs;
    }

    public List<String> getDeltaFields() {
        return deltaFields;
    }
}
