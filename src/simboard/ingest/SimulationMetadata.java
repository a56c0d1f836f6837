package simboard.ingest;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The normalized facts gathered from one experiment directory. Every field in {@link #FIELDS} is present;
 * values are strings or null.
 */
public class SimulationMetadata {
    public static final List<String> FIELDS = List.of(
            "name",
            "case_name",
            "compset",
            "compset_alias",
            "grid_name",
            "grid_resolution",
            "campaign",
            "experiment_type",
            "initialization_type",
            "group_name",
            "machine",
            "hpc_username",
            "simulation_start_date",
            "simulation_end_date",
            "run_start_date",
            "run_end_date",
            "status",
            "compiler",
            "mpilib",
            "git_repository_url",
            "git_branch",
            "git_tag",
            "git_commit_hash",
            "created_by",
            "last_updated_by",
            "parent_simulation_id",
            "simulation_type",
            "extra",
            "artifacts",
            "links");

    private final Path experimentDir;
    private final Map<String, String> values;

    /**
     * Projects {@code values} onto the field list. Unknown keys are dropped and absent fields are null.
     */
    public SimulationMetadata(Path experimentDir, Map<String, String> values) {
        this.experimentDir = experimentDir;
        Map<String, String> projected = new LinkedHashMap<>();
        for (String field : FIELDS) {
            projected.put(field, values.get(field));
        }
        this.values = Collections.unmodifiableMap(projected);
    }

    public String get(String field) {
        if (!values.containsKey(field)) {
            throw new IllegalArgumentException("unknown metadata field: " + field);
        }
        return values.get(field);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public Path getExperimentDir() {
        return experimentDir;
    }

    /**
     * The name runs are grouped by: the case name, falling back to the name and then "unknown".
     */
    public String getCaseKey() {
        String caseName = values.get("case_name");
        if (caseName != null && !caseName.isEmpty()) {
            return caseName;
        }
        String name = values.get("name");
        if (name != null && !name.isEmpty()) {
            return name;
        }
        return "unknown";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimulationMetadata that = (SimulationMetadata) o;
        return Objects.equals(experimentDir, that.experimentDir) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(experimentDir, values);
    }

    @Override
    public String toString() {
        return "SimulationMetadata{" + experimentDir + ", " + values + "}";
    }
}
