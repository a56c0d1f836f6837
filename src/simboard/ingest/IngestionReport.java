package simboard.ingest;

/**
 * A stored ingestion together with the engine's detailed result.
 */
public class IngestionReport {
    private final Ingestion ingestion;
    private final IngestArchiveResult result;

    public IngestionReport(Ingestion ingestion, IngestArchiveResult result) {
        this.ingestion = ingestion;
        this.result = result;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public IngestArchiveResult getResult() {
        return result;
    }
}
