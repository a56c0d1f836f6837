package simboard.simulation;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindBean;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.OffsetDateTime;
import java.util.List;

public interface SimulationsDAO {

    @SqlQuery("SELECT COUNT(*) FROM simulation WHERE case_name = :caseName AND machine_id = :machineId AND simulation_start_date = :startDate")
    long countSimulationsByKey(@Bind("caseName") String caseName, @Bind("machineId") long machineId, @Bind("startDate") OffsetDateTime simulationStartDate);

    @SqlQuery("SELECT COUNT(*) FROM simulation")
    long countSimulations();

    @SqlQuery("SELECT COUNT(*) FROM simulation WHERE ingestion_id = :ingestionId")
    long countSimulationsForIngestion(@Bind("ingestionId") long ingestionId);

    @SqlQuery("SELECT case_name FROM simulation ORDER BY id")
    List<String> listCaseNames();

    @SqlQuery("SELECT extra FROM simulation WHERE case_name = :caseName ORDER BY id")
    List<String> findExtraByCaseName(@Bind("caseName") String caseName);

    @SqlUpdate("INSERT INTO simulation (name, case_name, compset, compset_alias, grid_name, grid_resolution, simulation_type, status, campaign, experiment_type, initialization_type, group_name, machine_id, simulation_start_date, simulation_end_date, run_start_date, run_end_date, compiler, git_repository_url, git_branch, git_tag, git_commit_hash, hpc_username, created_by, last_updated_by, extra, ingestion_id, created_at) " +
            "VALUES (:s.name, :s.caseName, :s.compset, :s.compsetAlias, :s.gridName, :s.gridResolution, :simulationType, :status, :s.campaign, :s.experimentType, :s.initializationType, :s.groupName, :s.machineId, :s.simulationStartDate, :s.simulationEndDate, :s.runStartDate, :s.runEndDate, :s.compiler, :s.gitRepositoryUrl, :s.gitBranch, :s.gitTag, :s.gitCommitHash, :s.hpcUsername, :s.createdBy, :s.lastUpdatedBy, :extra, :ingestionId, CURRENT_TIMESTAMP)")
    @GetGeneratedKeys
    long insertSimulation(@BindBean("s") SimulationCreate simulation, @Bind("simulationType") String simulationType,
                          @Bind("status") String status, @Bind("extra") String extraJson,
                          @Bind("ingestionId") Long ingestionId);
}
