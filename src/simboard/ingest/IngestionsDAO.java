package simboard.ingest;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

@RegisterRowMapper(IngestionsDAO.IngestionMapper.class)
public interface IngestionsDAO {

    class IngestionMapper implements RowMapper<Ingestion> {
        @Override
        public Ingestion map(ResultSet r, StatementContext ctx) throws SQLException {
            return new Ingestion(r);
        }
    }

    @SqlQuery("SELECT * FROM ingestion WHERE id = :id")
    Ingestion findIngestionById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM ingestion ORDER BY id")
    List<Ingestion> listIngestions();

    @SqlUpdate("INSERT INTO ingestion (source_type, source_reference, triggered_by, created_at, status, created_count, duplicate_count, error_count, archive_sha256) " +
            "VALUES (:sourceType, :sourceReference, :triggeredBy, :createdAt, :status, :createdCount, :duplicateCount, :errorCount, :archiveSha256)")
    @GetGeneratedKeys
    long createIngestion(@Bind("sourceType") String sourceType, @Bind("sourceReference") String sourceReference,
                         @Bind("triggeredBy") String triggeredBy, @Bind("createdAt") OffsetDateTime createdAt,
                         @Bind("status") String status, @Bind("createdCount") int createdCount,
                         @Bind("duplicateCount") int duplicateCount, @Bind("errorCount") int errorCount,
                         @Bind("archiveSha256") String archiveSha256);
}
