package simboard.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simboard.archive.ArchiveFormat;
import simboard.core.DAO;
import simboard.core.NotFoundException;
import simboard.machine.Machines;
import simboard.simulation.SimulationCreate;
import simboard.simulation.Simulations;
import simboard.util.Digests;

import java.io.IOException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Ingests archives and stores the resulting simulations along with an audit record.
 */
public class Ingestions {
    private static final Logger log = LoggerFactory.getLogger(Ingestions.class);

    private final DAO dao;
    private final ArchiveIngester ingester;

    public Ingestions(DAO dao, IngestConfig config, Machines machines, Simulations simulations) {
        this(dao, new ArchiveIngester(config, machines, simulations));
    }

    public Ingestions(DAO dao, ArchiveIngester ingester) {
        this.dao = dao;
        this.ingester = ingester;
    }

    public Ingestion get(long id) {
        return NotFoundException.check(dao.ingestions().findIngestionById(id), "ingestion", id);
    }

    public List<Ingestion> listAll() {
        return dao.ingestions().listIngestions();
    }

    /**
     * Ingests an archive and stores the canonical simulations and an audit record in a single transaction.
     *
     * @param outputDir   empty directory to extract the archive into
     * @param triggeredBy user recorded as the creator of the new simulations, may be null
     * @throws simboard.archive.ArchiveRejectedException if the archive can't be ingested at all, nothing is stored
     */
    public IngestionReport ingestAndPersist(Path archive, Path outputDir, IngestionSourceType sourceType,
                                            String triggeredBy) throws IOException {
        ArchiveFormat.of(archive);
        String sha256 = Digests.sha256(archive);
        IngestArchiveResult result = ingester.ingest(archive, outputDir);

        Ingestion ingestion = new Ingestion();
        ingestion.setSourceType(sourceType);
        ingestion.setSourceReference(archive.toString());
        ingestion.setTriggeredBy(triggeredBy);
        ingestion.setCreatedAt(OffsetDateTime.now(ZoneOffset.UTC));
        ingestion.setStatus(IngestionStatus.of(result));
        ingestion.setCreatedCount(result.getCreatedCount());
        ingestion.setDuplicateCount(result.getDuplicateCount());
        ingestion.setErrorCount(result.getErrors().size());
        ingestion.setArchiveSha256(sha256);

        long ingestionId = dao.inTransaction(tx -> {
            long id = tx.ingestions().createIngestion(ingestion.getSourceType().value(),
                    ingestion.getSourceReference(), ingestion.getTriggeredBy(), ingestion.getCreatedAt(),
                    ingestion.getStatus().value(), ingestion.getCreatedCount(), ingestion.getDuplicateCount(),
                    ingestion.getErrorCount(), ingestion.getArchiveSha256());
            Simulations simulations = new Simulations(tx.simulations());
            for (SimulationCreate simulation : result.getSimulations()) {
                simulation.setCreatedBy(triggeredBy);
                simulation.setLastUpdatedBy(triggeredBy);
                simulations.insert(simulation, id);
            }
            return id;
        });
        ingestion.setId(ingestionId);

        log.info("Stored ingestion {} of {} ({}): {} created, {} duplicates, {} errors", ingestionId, archive,
                ingestion.getStatus(), ingestion.getCreatedCount(), ingestion.getDuplicateCount(),
                ingestion.getErrorCount());
        return new IngestionReport(ingestion, result);
    }
}
