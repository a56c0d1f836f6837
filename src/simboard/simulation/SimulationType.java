package simboard.simulation;

import com.google.gson.annotations.SerializedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public enum SimulationType {
    @SerializedName("unknown") UNKNOWN("unknown"),
    @SerializedName("production") PRODUCTION("production"),
    @SerializedName("experimental") EXPERIMENTAL("experimental"),
    @SerializedName("test") TEST("test");

    private static final Logger log = LoggerFactory.getLogger(SimulationType.class);

    private final String value;

    SimulationType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses free text into a simulation type, falling back to {@link #UNKNOWN}.
     */
    public static SimulationType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.strip();
        for (SimulationType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        try {
            return valueOf(normalized.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown simulation_type '{}'; defaulting to '{}'", raw, UNKNOWN.value);
            return UNKNOWN;
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
