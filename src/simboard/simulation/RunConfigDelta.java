package simboard.simulation;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration differences between a later run of a case and the case's canonical run.
 */
public class RunConfigDelta {
    @SerializedName("exp_dir")
    private final String expDir;
    private final Map<String, FieldDelta> deltas;

    public RunConfigDelta(String expDir, Map<String, FieldDelta> deltas) {
        this.expDir = expDir;
        this.deltas = Collections.unmodifiableMap(new LinkedHashMap<>(deltas));
    }

    public String getExpDir() {
        return expDir;
    }

    public Map<String, FieldDelta> getDeltas() {
        return deltas;
    }

    public static class FieldDelta {
        private final String canonical;
        private final String current;

        public FieldDelta(String canonical, String current) {
            this.canonical = canonical;
            this.current = current;
        }

        public String getCanonical() {
            return canonical;
        }

        public String getCurrent() {
            return current;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FieldDelta)) return false;
            FieldDelta that = (FieldDelta) o;
            return Objects.equals(canonical, that.canonical) && Objects.equals(current, that.current);
        }

        @Override
        public int hashCode() {
            return Objects.hash(canonical, current);
        }

        @Override
        public String toString() {
            return "{canonical=" + canonical + ", current=" + current + "}";
        }
    }

    @Override
    public String toString() {
        return "RunConfigDelta{" +
                "expDir='" + expDir + '\'' +
                ", deltas=" + deltas +
                '}';
    }
}
