package simboard.ingest;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simboard.core.NotFoundException;
import simboard.simulation.RunConfigDelta;
import simboard.simulation.RunConfigDelta.FieldDelta;
import simboard.simulation.SimulationCreate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reduces the runs found in an archive to one simulation per case.
 * <p>
 * Runs are taken in experiment directory order. The first run of a case that isn't already stored becomes its
 * canonical simulation. Later runs of the same case are not stored; their configuration differences from the
 * canonical run are attached to it instead. A run that is already stored, or whose key was already seen earlier
 * in the same archive, counts as a duplicate. A stored run still acts as the baseline for later runs of its case.
 */
public class CanonicalRunSelector {
    private final Logger log;
    private final DeduplicationGate gate;
    private final SimulationMapper mapper;
    private final List<String> deltaFields;

    public CanonicalRunSelector(DeduplicationGate gate, SimulationMapper mapper, List<String> deltaFields) {
        this(gate, mapper, deltaFields, LoggerFactory.getLogger(CanonicalRunSelector.class));
    }

    public CanonicalRunSelector(DeduplicationGate gate, SimulationMapper mapper, List<String> deltaFields, Logger log) {
        this.gate = gate;
        this.mapper = mapper;
        this.deltaFields = List.copyOf(deltaFields);
        this.log = log;
    }

    public IngestArchiveResult select(List<SimulationMetadata> runs) {
        Map<String, List<SimulationMetadata>> cases = new LinkedHashMap<>();
        for (SimulationMetadata run : runs) {
            cases.computeIfAbsent(run.getCaseKey(), k -> new ArrayList<>()).add(run);
        }

        List<SimulationCreate> simulations = new ArrayList<>();
        List<IngestionError> errors = new ArrayList<>();
        int duplicateCount = 0;
        int skippedCount = 0;
        Set<DeduplicationKey> seenKeys = new HashSet<>();

        for (List<SimulationMetadata> caseRuns : cases.values()) {
            SimulationMetadata canonical = null;
            SimulationCreate canonicalSimulation = null;

            for (SimulationMetadata run : caseRuns) {
                String expDir = run.getExperimentDir().toString();
                try {
                    DeduplicationKey key = gate.keyFor(run);

                    if (seenKeys.contains(key) || gate.isDuplicate(key)) {
                        log.info("Skipping duplicate from {}", expDir);
                        duplicateCount++;
                        if (canonical == null) {
                            canonical = run;
                        }
                        continue;
                    }

                    if (canonical == null) {
                        canonicalSimulation = mapper.map(run, key.getMachineId());
                        canonical = run;
                        simulations.add(canonicalSimulation);
                        seenKeys.add(key);
                        log.info("Mapped canonical simulation from {}: {}", expDir, run.get("name"));
                    } else {
                        Map<String, FieldDelta> deltas = computeDelta(canonical, run, deltaFields);
                        if (deltas.isEmpty()) {
                            log.info("Run in {} has the same configuration as canonical run {}", expDir,
                                    canonical.getExperimentDir());
                        } else {
                            log.info("Run in {} differs from canonical run {} in {}", expDir,
                                    canonical.getExperimentDir(), deltas.keySet());
                            if (canonicalSimulation != null) {
                                canonicalSimulation.addRunConfigDelta(new RunConfigDelta(expDir, deltas));
                            }
                        }
                        seenKeys.add(key);
                        skippedCount++;
                    }
                } catch (IllegalArgumentException e) {
                    errors.add(recordError(expDir, IngestionError.VALUE_ERROR, e));
                } catch (NotFoundException e) {
                    errors.add(recordError(expDir, IngestionError.LOOKUP_ERROR, e));
                } catch (ConstraintViolationException e) {
                    errors.add(recordError(expDir, IngestionError.VALIDATION_ERROR, e));
                }
            }
        }

        return new IngestArchiveResult(simulations, duplicateCount, skippedCount, errors);
    }

    private IngestionError recordError(String expDir, String errorType, RuntimeException e) {
        log.error("Failed to process simulation from {}: {}", expDir, e.getMessage());
        return new IngestionError(expDir, errorType, e.getMessage());
    }

    /**
     * Compares the given fields of two runs.
     *
     * @return field to canonical and current value, for each field that differs, in field order
     */
    static Map<String, FieldDelta> computeDelta(SimulationMetadata canonical, SimulationMetadata other,
                                                List<String> fields) {
        Map<String, FieldDelta> deltas = new LinkedHashMap<>();
        for (String field : fields) {
            String canonicalValue = canonical.get(field);
            String currentValue = other.get(field);
            if (!Objects.equals(canonicalValue, currentValue)) {
                deltas.put(field, new FieldDelta(canonicalValue, currentValue));
            }
        }
        return deltas;
    }
}
