package simboard.simulation;

import com.google.gson.annotations.SerializedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public enum SimulationStatus {
    @SerializedName("unknown") UNKNOWN("unknown"),
    @SerializedName("created") CREATED("created"),
    @SerializedName("queued") QUEUED("queued"),
    @SerializedName("running") RUNNING("running"),
    @SerializedName("failed") FAILED("failed"),
    @SerializedName("completed") COMPLETED("completed");

    private static final Logger log = LoggerFactory.getLogger(SimulationStatus.class);

    private final String value;

    SimulationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses free text into a status. Never fails: null, blank or unrecognised text yields {@link #CREATED}.
     */
    public static SimulationStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return CREATED;
        }
        String normalized = raw.strip();
        for (SimulationStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        try {
            return valueOf(normalized.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown status '{}'; defaulting to '{}'", raw, CREATED.value);
            return CREATED;
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
