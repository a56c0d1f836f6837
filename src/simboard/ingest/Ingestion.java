package simboard.ingest;

import com.google.gson.annotations.SerializedName;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;

/**
 * Audit record of one ingestion.
 */
public class Ingestion {
    private Long id;
    @SerializedName("source_type") private IngestionSourceType sourceType;
    @SerializedName("source_reference") private String sourceReference;
    @SerializedName("triggered_by") private String triggeredBy;
    @SerializedName("created_at") private OffsetDateTime createdAt;
    private IngestionStatus status;
    @SerializedName("created_count") private int createdCount;
    @SerializedName("duplicate_count") private int duplicateCount;
    @SerializedName("error_count") private int errorCount;
    @SerializedName("archive_sha256") private String archiveSha256;

    public Ingestion() {
    }

    public Ingestion(ResultSet rs) throws SQLException {
        setId(rs.getLong("id"));
        setSourceType(IngestionSourceType.fromValue(rs.getString("source_type")));
        setSourceReference(rs.getString("source_reference"));
        setTriggeredBy(rs.getString("triggered_by"));
        setCreatedAt(rs.getObject("created_at", OffsetDateTime.class));
        setStatus(IngestionStatus.fromValue(rs.getString("status")));
        setCreatedCount(rs.getInt("created_count"));
        setDuplicateCount(rs.getInt("duplicate_count"));
        setErrorCount(rs.getInt("error_count"));
        setArchiveSha256(rs.getString("archive_sha256"));
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public IngestionSourceType getSourceType() {
        return sourceType;
    }

    public void setSourceType(IngestionSourceType sourceType) {
        this.sourceType = sourceType;
    }

    public String getSourceReference() {
        return sourceReference;
    }

    public void setSourceReference(String sourceReference) {
        this.sourceReference = sourceReference;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public void setTriggeredBy(String triggeredBy) {
        this.triggeredBy = triggeredBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public IngestionStatus getStatus() {
        return status;
    }

    public void setStatus(IngestionStatus status) {
        this.status = status;
    }

    public int getCreatedCount() {
        return createdCount;
    }

    public void setCreatedCount(int createdCount) {
        this.createdCount = createdCount;
    }

    public int getDuplicateCount() {
        return duplicateCount;
    }

    public void setDuplicateCount(int duplicateCount) {
        this.duplicateCount = duplicateCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public void setErrorCount(int errorCount) {
        this.errorCount = errorCount;
    }

    public String getArchiveSha256() {
        return archiveSha256;
    }

    public void setArchiveSha256(String archiveSha256) {
        this.archiveSha256 = archiveSha256;
    }
}
