package simboard.ingest;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simboard.simulation.SimulationCreate;
import simboard.simulation.SimulationStatus;
import simboard.simulation.SimulationType;
import simboard.util.Dates;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts assembled metadata into a validated {@link SimulationCreate}.
 */
public class SimulationMapper {
    private static final Logger defaultLog = LoggerFactory.getLogger(SimulationMapper.class);
    private static final Validator defaultValidator = buildValidator();

    private final Logger log;
    private final Validator validator;

    public SimulationMapper() {
        this(defaultValidator, defaultLog);
    }

    public SimulationMapper(Validator validator, Logger log) {
        this.validator = validator;
        this.log = log;
    }

    private static Validator buildValidator() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return factory.getValidator();
    }

    /**
     * @throws ConstraintViolationException if a required field is missing
     */
    public SimulationCreate map(SimulationMetadata metadata, long machineId) {
        SimulationCreate simulation = new SimulationCreate();
        simulation.setName(metadata.get("name"));
        simulation.setCaseName(metadata.get("case_name"));
        simulation.setCompset(metadata.get("compset"));
        simulation.setCompsetAlias(metadata.get("compset_alias"));
        simulation.setGridName(metadata.get("grid_name"));
        simulation.setGridResolution(metadata.get("grid_resolution"));
        simulation.setSimulationType(SimulationType.parse(metadata.get("simulation_type")));
        simulation.setStatus(SimulationStatus.parse(metadata.get("status")));
        simulation.setInitializationType(metadata.get("initialization_type"));
        simulation.setMachineId(machineId);
        simulation.setSimulationStartDate(Dates.parseDateTime(metadata.get("simulation_start_date")));
        simulation.setSimulationEndDate(Dates.parseDateTime(metadata.get("simulation_end_date")));
        simulation.setExperimentType(metadata.get("experiment_type"));
        simulation.setCampaign(metadata.get("campaign"));
        simulation.setGroupName(metadata.get("group_name"));
        simulation.setRunStartDate(Dates.parseDateTime(metadata.get("run_start_date")));
        simulation.setRunEndDate(Dates.parseDateTime(metadata.get("run_end_date")));
        simulation.setCompiler(metadata.get("compiler"));
        simulation.setGitRepositoryUrl(normalizeGitUrl(metadata.get("git_repository_url")));
        simulation.setGitBranch(metadata.get("git_branch"));
        simulation.setGitTag(metadata.get("git_tag"));
        simulation.setGitCommitHash(metadata.get("git_commit_hash"));
        simulation.setHpcUsername(metadata.get("hpc_username"));
        // archive usernames are local HPC accounts, the uploader is recorded when the simulation is stored
        simulation.setCreatedBy(null);
        simulation.setLastUpdatedBy(null);

        validate(simulation);
        return simulation;
    }

    private void validate(SimulationCreate simulation) {
        Set<ConstraintViolation<SimulationCreate>> violations = validator.validate(simulation);
        if (violations.isEmpty()) {
            return;
        }
        List<String> problems = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toList());
        throw new ConstraintViolationException("Invalid simulation " + simulation.getCaseName() + ": "
                + String.join("; ", problems), violations);
    }

    /**
     * Rewrites SSH remotes like {@code git@github.com:owner/repo.git} as https URLs. Other URLs are returned
     * unchanged.
     */
    public String normalizeGitUrl(String url) {
        if (url == null || url.isEmpty()) {
            return null;
        }
        if (url.startsWith("https://") || url.startsWith("http://")) {
            return url;
        }
        if (url.startsWith("git@")) {
            String hostAndPath = url.substring("git@".length());
            int colon = hostAndPath.indexOf(':');
            if (colon < 0) {
                log.warn("Could not normalize git URL: {}", url);
                return url;
            }
            return "https://" + hostAndPath.substring(0, colon) + "/" + hostAndPath.substring(colon + 1);
        }
        return url;
    }
}
