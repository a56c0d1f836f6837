package simboard.ingest;

import com.google.gson.annotations.SerializedName;
import simboard.simulation.SimulationCreate;

import java.util.List;

/**
 * Outcome of ingesting one archive: the canonical simulations ready to be stored and what happened to the
 * other runs.
 */
public class IngestArchiveResult {
    private final List<SimulationCreate> simulations;
    @SerializedName("created_count")
    private final int createdCount;
    @SerializedName("duplicate_count")
    private final int duplicateCount;
    @SerializedName("skipped_count")
    private final int skippedCount;
    private final List<IngestionError> errors;

    public IngestArchiveResult(List<SimulationCreate> simulations, int duplicateCount, int skippedCount,
                               List<IngestionError> errors) {
        this.simulations = List.copyOf(simulations);
        this.createdCount = this.simulations.size();
        this.duplicateCount = duplicateCount;
        this.skippedCount = skippedCount;
        this.errors = List.copyOf(errors);
    }

    public List<SimulationCreate> getSimulations() {
        return simulations;
    }

    public int getCreatedCount() {
        return createdCount;
    }

    public int getDuplicateCount() {
        return duplicateCount;
    }

    /**
     * Runs that were folded into their case's canonical simulation as configuration deltas.
     */
    public int getSkippedCount() {
        return skippedCount;
    }

    public List<IngestionError> getErrors() {
        return errors;
    }
}
