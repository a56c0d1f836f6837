package simboard.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simboard.util.Dates;

import java.time.OffsetDateTime;

/**
 * Builds the deduplication key of a run and checks it against previously stored simulations.
 */
public class DeduplicationGate {
    private final Logger log;
    private final MachineResolver machines;
    private final DuplicateLookup duplicates;

    public DeduplicationGate(MachineResolver machines, DuplicateLookup duplicates) {
        this(machines, duplicates, LoggerFactory.getLogger(DeduplicationGate.class));
    }

    public DeduplicationGate(MachineResolver machines, DuplicateLookup duplicates, Logger log) {
        this.machines = machines;
        this.duplicates = duplicates;
        this.log = log;
    }

    /**
     * @throws IllegalArgumentException if the machine name or a parseable simulation start date is missing
     * @throws simboard.core.NotFoundException if the machine is not registered
     */
    public DeduplicationKey keyFor(SimulationMetadata metadata) {
        String machineName = metadata.get("machine");
        if (machineName == null || machineName.isEmpty()) {
            throw new IllegalArgumentException("Machine name is required but not found in metadata");
        }
        long machineId = machines.resolveMachineId(machineName);

        OffsetDateTime startDate = Dates.parseDateTime(metadata.get("simulation_start_date"));
        if (startDate == null) {
            throw new IllegalArgumentException("simulation_start_date is required but could not be parsed");
        }
        return new DeduplicationKey(metadata.getCaseKey(), machineId, startDate);
    }

    public boolean isDuplicate(DeduplicationKey key) {
        boolean exists = duplicates.exists(key);
        if (exists) {
            log.info("Simulation already exists with {}", key);
        }
        return exists;
    }
}
