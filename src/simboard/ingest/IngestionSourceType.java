package simboard.ingest;

import com.google.gson.annotations.SerializedName;

/**
 * Where an ingested archive came from.
 */
public enum IngestionSourceType {
    @SerializedName("hpc_path") HPC_PATH("hpc_path"),
    @SerializedName("hpc_upload") HPC_UPLOAD("hpc_upload"),
    @SerializedName("browser_upload") BROWSER_UPLOAD("browser_upload");

    private final String value;

    IngestionSourceType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static IngestionSourceType fromValue(String value) {
        for (IngestionSourceType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown ingestion source type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
