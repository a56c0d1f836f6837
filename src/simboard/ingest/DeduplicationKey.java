package simboard.ingest;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Identifies a simulation across ingestions: the same case on the same machine starting at the same time.
 */
public class DeduplicationKey {
    private final String caseName;
    private final long machineId;
    private final OffsetDateTime simulationStartDate;

    public DeduplicationKey(String caseName, long machineId, OffsetDateTime simulationStartDate) {
        this.caseName = Objects.requireNonNull(caseName);
        this.machineId = machineId;
        this.simulationStartDate = Objects.requireNonNull(simulationStartDate);
    }

    public String getCaseName() {
        return caseName;
    }

    public long getMachineId() {
        return machineId;
    }

    public OffsetDateTime getSimulationStartDate() {
        return simulationStartDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeduplicationKey)) return false;
        DeduplicationKey that = (DeduplicationKey) o;
        return machineId == that.machineId &&
                caseName.equals(that.caseName) &&
                simulationStartDate.isEqual(that.simulationStartDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caseName, machineId, simulationStartDate.toInstant());
    }

    @Override
    public String toString() {
        return "case_name='" + caseName + "', machine_id=" + machineId + ", simulation_start_date=" + simulationStartDate;
    }
}
