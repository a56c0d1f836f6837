package simboard.simulation;

import com.google.gson.Gson;
import simboard.ingest.DeduplicationKey;
import simboard.ingest.DuplicateLookup;
import simboard.util.Json;

public class Simulations implements DuplicateLookup {
    private static final Gson gson = Json.compact();

    private final SimulationsDAO dao;

    public Simulations(SimulationsDAO simulationsDAO) {
        this.dao = simulationsDAO;
    }

    @Override
    public boolean exists(DeduplicationKey key) {
        return dao.countSimulationsByKey(key.getCaseName(), key.getMachineId(), key.getSimulationStartDate()) > 0;
    }

    public long count() {
        return dao.countSimulations();
    }

    /**
     * Stores a simulation. The unique key on (case_name, machine_id, simulation_start_date) rejects a second
     * copy stored by a concurrent ingestion.
     *
     * @return the id of the new simulation
     */
    public long insert(SimulationCreate simulation, Long ingestionId) {
        String extra = simulation.getExtra().isEmpty() ? null : gson.toJson(simulation.getExtra());
        return dao.insertSimulation(simulation, simulation.getSimulationType().value(),
                simulation.getStatus().value(), extra, ingestionId);
    }
}
