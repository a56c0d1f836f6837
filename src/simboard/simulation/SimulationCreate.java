package simboard.simulation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A simulation record ready to be persisted.
 */
public class SimulationCreate {
    public static final String RUN_CONFIG_DELTAS = "run_config_deltas";

    @NotBlank private String name;
    @NotBlank private String caseName;
    @NotBlank private String compset;
    @NotBlank private String compsetAlias;
    @NotBlank private String gridName;
    @NotBlank private String gridResolution;
    @NotNull private SimulationType simulationType;
    @NotNull private SimulationStatus status;
    @NotBlank private String initializationType;
    @NotNull private Long machineId;
    @NotNull private OffsetDateTime simulationStartDate;
    private OffsetDateTime simulationEndDate;
    private String experimentType;
    private String campaign;
    private String groupName;
    private OffsetDateTime runStartDate;
    private OffsetDateTime runEndDate;
    private String compiler;
    private String gitRepositoryUrl;
    private String gitBranch;
    private String gitTag;
    private String gitCommitHash;
    private String hpcUsername;
    private String createdBy;
    private String lastUpdatedBy;
    private final Map<String, Object> extra = new LinkedHashMap<>();
    private final transient List<RunConfigDelta> runConfigDeltas = new ArrayList<>();

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getCaseName() {
		return caseName;
	}

	public void setCaseName(String caseName) {
		this.caseName = caseName;
	}

	public String getCompset() {
		return compset;
	}

	public void setCompset(String compset) {
		this.compset = compset;
	}

	public String getCompsetAlias() {
		return compsetAlias;
	}

	public void setCompsetAlias(String compsetAlias) {
		this.compsetAlias = compsetAlias;
	}

	public String getGridName() {
		return gridName;
	}

	public void setGridName(String gridName) {
		this.gridName = gridName;
	}

	public String getGridResolution() {
		return gridResolution;
	}

	public void setGridResolution(String gridResolution) {
		this.gridResolution = gridResolution;
	}

	public SimulationType getSimulationType() {
		return simulationType;
	}

	public void setSimulationType(SimulationType simulationType) {
		this.simulationType = simulationType;
	}

	public SimulationStatus getStatus() {
		return status;
	}

	public void setStatus(SimulationStatus status) {
		this.status = status;
	}

	public String getInitializationType() {
		return initializationType;
	}

	public void setInitializationType(String initializationType) {
		this.initializationType = initializationType;
	}

	public Long getMachineId() {
		return machineId;
	}

	public void setMachineId(Long machineId) {
		this.machineId = machineId;
	}

	public OffsetDateTime getSimulationStartDate() {
		return simulationStartDate;
	}

	public void setSimulationStartDate(OffsetDateTime simulationStartDate) {
		this.simulationStartDate = simulationStartDate;
	}

	public OffsetDateTime getSimulationEndDate() {
		return simulationEndDate;
	}

	public void setSimulationEndDate(OffsetDateTime simulationEndDate) {
		this.simulationEndDate = simulationEndDate;
	}

	public String getExperimentType() {
		return experimentType;
	}

	public void setExperimentType(String experimentType) {
		this.experimentType = experimentType;
	}

	public String getCampaign() {
		return campaign;
	}

	public void setCampaign(String campaign) {
		this.campaign = campaign;
	}

	public String getGroupName() {
		return groupName;
	}

	public void setGroupName(String groupName) {
		this.groupName = groupName;
	}

	public OffsetDateTime getRunStartDate() {
		return runStartDate;
	}

	public void setRunStartDate(OffsetDateTime runStartDate) {
		this.runStartDate = runStartDate;
	}

	public OffsetDateTime getRunEndDate() {
		return runEndDate;
	}

	public void setRunEndDate(OffsetDateTime runEndDate) {
		this.runEndDate = runEndDate;
	}

	public String getCompiler() {
		return compiler;
	}

	public void setCompiler(String compiler) {
		this.compiler = compiler;
	}

	public String getGitRepositoryUrl() {
		return gitRepositoryUrl;
	}

	public void setGitRepositoryUrl(String gitRepositoryUrl) {
		this.gitRepositoryUrl = gitRepositoryUrl;
	}

	public String getGitBranch() {
		return gitBranch;
	}

	public void setGitBranch(String gitBranch) {
		this.gitBranch = gitBranch;
	}

	public String getGitTag() {
		return gitTag;
	}

	public void setGitTag(String gitTag) {
		this.gitTag = gitTag;
	}

	public String getGitCommitHash() {
		return gitCommitHash;
	}

	public void setGitCommitHash(String gitCommitHash) {
		this.gitCommitHash = gitCommitHash;
	}

	public String getHpcUsername() {
		return hpcUsername;
	}

	public void setHpcUsername(String hpcUsername) {
		this.hpcUsername = hpcUsername;
	}

	public String getCreatedBy() {
		return createdBy;
	}

	public void setCreatedBy(String createdBy) {
		this.createdBy = createdBy;
	}

	public String getLastUpdatedBy() {
		return lastUpdatedBy;
	}

	public void setLastUpdatedBy(String lastUpdatedBy) {
		this.lastUpdatedBy = lastUpdatedBy;
	}

	/**
	 * Free-form extra attributes. Run configuration deltas appear under {@link #RUN_CONFIG_DELTAS}
	 * once at least one has been attached.
	 */
	public Map<String, Object> getExtra() {
		return Collections.unmodifiableMap(extra);
	}

	public void putExtra(String key, Object value) {
		if (RUN_CONFIG_DELTAS.equals(key)) {
			throw new IllegalArgumentException(key + " is managed by addRunConfigDelta");
		}
		extra.put(key, value);
	}

	public List<RunConfigDelta> getRunConfigDeltas() {
		return Collections.unmodifiableList(runConfigDeltas);
	}

	public void addRunConfigDelta(RunConfigDelta delta) {
		runConfigDeltas.add(delta);
		extra.put(RUN_CONFIG_DELTAS, getRunConfigDeltas());
	}
}
