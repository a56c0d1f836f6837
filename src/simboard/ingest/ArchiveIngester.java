package simboard.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simboard.archive.ArchiveExtractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns an archive of E3SM performance data into canonical simulation records.
 * <p>
 * Nothing is stored here: the caller persists the returned simulations, normally through
 * {@link Ingestions#ingestAndPersist}.
 */
public class ArchiveIngester {
    private final Logger log;
    private final ArchiveExtractor extractor;
    private final ExperimentLocator experimentLocator;
    private final ExperimentFileLocator fileLocator;
    private final MetadataAssembler assembler;
    private final CanonicalRunSelector selector;

    public ArchiveIngester(IngestConfig config, MachineResolver machines, DuplicateLookup duplicates) {
        this(config, machines, duplicates, LoggerFactory.getLogger(ArchiveIngester.class));
    }

    public ArchiveIngester(IngestConfig config, MachineResolver machines, DuplicateLookup duplicates, Logger log) {
        this(new ArchiveExtractor(),
                new ExperimentLocator(),
                new ExperimentFileLocator(config.getFileSpecs()),
                new MetadataAssembler(config.getFileSpecs()),
                new CanonicalRunSelector(new DeduplicationGate(machines, duplicates), new SimulationMapper(),
                        config.getDeltaFields()),
                log);
    }

    public ArchiveIngester(ArchiveExtractor extractor, ExperimentLocator experimentLocator,
                           ExperimentFileLocator fileLocator, MetadataAssembler assembler,
                           CanonicalRunSelector selector, Logger log) {
        this.extractor = extractor;
        this.experimentLocator = experimentLocator;
        this.fileLocator = fileLocator;
        this.assembler = assembler;
        this.selector = selector;
        this.log = log;
    }

    /**
     * Extracts the archive into {@code outputDir} and ingests every complete experiment in it.
     *
     * @throws simboard.archive.ArchiveRejectedException if the archive can't be ingested at all
     */
    public IngestArchiveResult ingest(Path archive, Path outputDir) throws IOException {
        extractor.extract(archive, outputDir);
        List<SimulationMetadata> runs = parseExperiments(outputDir);
        if (runs.isEmpty()) {
            log.warn("No complete simulations found in archive {}", archive);
        }
        IngestArchiveResult result = selector.select(runs);
        log.info("Ingested {}: {} created, {} duplicates, {} folded into canonical runs, {} errors", archive,
                result.getCreatedCount(), result.getDuplicateCount(), result.getSkippedCount(),
                result.getErrors().size());
        return result;
    }

    /**
     * Parses the complete experiments below {@code rootDir}, skipping incomplete ones.
     */
    public List<SimulationMetadata> parseExperiments(Path rootDir) throws IOException {
        List<SimulationMetadata> runs = new ArrayList<>();
        for (Path experimentDir : experimentLocator.findExperimentDirs(rootDir)) {
            Map<String, Path> files;
            try {
                files = fileLocator.locate(experimentDir);
            } catch (MissingRequiredFilesException e) {
                log.info("Skipping incomplete run: {}", e.getMessage());
                continue;
            }
            runs.add(assembler.assemble(experimentDir, files));
        }
        return runs;
    }
}
