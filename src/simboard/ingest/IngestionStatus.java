package simboard.ingest;

import com.google.gson.annotations.SerializedName;

public enum IngestionStatus {
    @SerializedName("success") SUCCESS("success"),
    @SerializedName("partial") PARTIAL("partial"),
    @SerializedName("failed") FAILED("failed");

    private final String value;

    IngestionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Success when nothing went wrong, partial when some simulations were created despite errors and failed
     * when there were errors and nothing was created.
     */
    public static IngestionStatus of(IngestArchiveResult result) {
        if (result.getErrors().isEmpty()) {
            return SUCCESS;
        }
        return result.getCreatedCount() > 0 ? PARTIAL : FAILED;
    }

    public static IngestionStatus fromValue(String value) {
        for (IngestionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown ingestion status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
