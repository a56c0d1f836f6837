package simboard.ingest;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * An experiment that could not be ingested. The error type is one of {@link #VALUE_ERROR},
 * {@link #LOOKUP_ERROR} or {@link #VALIDATION_ERROR}.
 */
public class IngestionError {
    public static final String VALUE_ERROR = "ValueError";
    public static final String LOOKUP_ERROR = "LookupError";
    public static final String VALIDATION_ERROR = "ValidationError";

    @SerializedName("exp_dir")
    private final String expDir;
    @SerializedName("error_type")
    private final String errorType;
    private final String error;

    public IngestionError(String expDir, String errorType, String error) {
        this.expDir = expDir;
        this.errorType = errorType;
        this.error = error;
    }

    public String getExpDir() {
        return expDir;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IngestionError)) return false;
        IngestionError that = (IngestionError) o;
        return Objects.equals(expDir, that.expDir) &&
                Objects.equals(errorType, that.errorType) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expDir, errorType, error);
    }

    @Override
    public String toString() {
        return errorType + " in " + expDir + ": " + error;
    }
}
