package simboard.simulation;

/**
 * Experiment types recognised as the final dot-separated segment of a case name.
 */
public enum ExperimentType {
    // DECK core experiments
    PI_CONTROL("piControl"),
    HISTORICAL("historical"),
    AMIP("amip"),
    ABRUPT_4XCO2("abrupt-4xCO2"),
    ONE_PCT_CO2("1pctCO2"),

    // ScenarioMIP
    SSP119("ssp119"),
    SSP126("ssp126"),
    SSP245("ssp245"),
    SSP370("ssp370"),
    SSP585("ssp585"),

    // ESM variants
    ESM_HIST("esm-hist"),
    ESM_PICONTROL("esm-piControl");

    private final String value;

    ExperimentType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static boolean isKnown(String candidate) {
        if (candidate == null) {
            return false;
        }
        for (ExperimentType type : values()) {
            if (type.value.equals(candidate)) {
                return true;
            }
        }
        return false;
    }
}
