package simboard.core;

import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import simboard.ingest.IngestionsDAO;
import simboard.machine.MachinesDAO;
import simboard.simulation.SimulationsDAO;

public interface DAO extends Transactional<DAO> {
	@CreateSqlObject MachinesDAO machines();
	@CreateSqlObject SimulationsDAO simulations();
	@CreateSqlObject IngestionsDAO ingestions();
}
