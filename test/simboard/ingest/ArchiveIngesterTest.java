package simboard.ingest;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import simboard.archive.UnsafeArchiveException;
import simboard.core.NotFoundException;
import simboard.simulation.SimulationCreate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.Assert.*;

public class ArchiveIngesterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final Set<DeduplicationKey> stored = new HashSet<>();
    private final ArchiveIngester ingester = new ArchiveIngester(IngestConfig.defaults(), name -> {
        if ("chrysalis".equals(name)) {
            return 1L;
        }
        throw new NotFoundException("machine", name);
    }, stored::contains);

    private Path caseDir() throws IOException {
        return Files.createDirectories(tmp.getRoot().toPath().resolve("src/performance_archive/chrysalis/v3.LR.historical_0121"));
    }

    @Test
    public void endToEndTarGz() throws IOException {
        new ExperimentFixture().writeTo(caseDir(), "1234567.250101-120000");
        Path archive = ExperimentFixture.tarGz(tmp.getRoot().toPath().resolve("src"),
                tmp.getRoot().toPath().resolve("archive.tar.gz"));

        IngestArchiveResult result = ingester.ingest(archive, tmp.newFolder("out").toPath());

        assertEquals(1, result.getCreatedCount());
        assertEquals(0, result.getDuplicateCount());
        assertTrue(result.getErrors().isEmpty());
        SimulationCreate simulation = result.getSimulations().get(0);
        assertEquals("v3.LR.historical", simulation.getCampaign());
        assertEquals("historical", simulation.getExperimentType());
        assertEquals("ne30pg2_r05", simulation.getGridName());
        assertEquals("WCYCL20TR", simulation.getCompset());
        assertEquals("https://github.com/E3SM-Project/E3SM.git", simulation.getGitRepositoryUrl());
        assertEquals("intel", simulation.getCompiler());
    }

    @Test
    public void endToEndZipWithLaterRunOfTheSameCase() throws IOException {
        Path caseDir = caseDir();
        new ExperimentFixture().writeTo(caseDir, "1234567.250101-120000");
        new ExperimentFixture().compiler("gnu").runStartDate("1855-01-01").writeTo(caseDir, "1234999.250201-120000");
        Path archive = ExperimentFixture.zip(tmp.getRoot().toPath().resolve("src"),
                tmp.getRoot().toPath().resolve("archive.zip"));

        IngestArchiveResult result = ingester.ingest(archive, tmp.newFolder("out").toPath());

        assertEquals(1, result.getCreatedCount());
        assertEquals(1, result.getSkippedCount());
        SimulationCreate simulation = result.getSimulations().get(0);
        assertEquals("intel", simulation.getCompiler());
        assertEquals(1, simulation.getRunConfigDeltas().size());
        assertEquals(1, simulation.getRunConfigDeltas().get(0).getDeltas().size());
        assertEquals("gnu", simulation.getRunConfigDeltas().get(0).getDeltas().get("compiler").getCurrent());
        assertTrue(simulation.getRunConfigDeltas().get(0).getExpDir().endsWith("1234999.250201-120000"));
    }

    @Test
    public void incompleteRunsAreSilentlyExcludedAndBadDatesAreErrors() throws IOException {
        Path root = tmp.getRoot().toPath().resolve("src/performance_archive/chrysalis");
        new ExperimentFixture().caseName("caseA_0001").writeTo(Files.createDirectories(root.resolve("caseA")),
                "1.250101-000000");
        new ExperimentFixture().caseName("caseB_0001").withoutCaseStatus()
                .writeTo(Files.createDirectories(root.resolve("caseB")), "2.250101-000000");
        new ExperimentFixture().caseName("caseC_0001").currDate("garbage").runStartDate(null)
                .writeTo(Files.createDirectories(root.resolve("caseC")), "3.250101-000000");
        Path archive = ExperimentFixture.tarGz(tmp.getRoot().toPath().resolve("src"),
                tmp.getRoot().toPath().resolve("archive.tgz"));

        IngestArchiveResult result = ingester.ingest(archive, tmp.newFolder("out").toPath());

        assertEquals(1, result.getCreatedCount());
        assertEquals("caseA_0001", result.getSimulations().get(0).getCaseName());
        assertEquals(1, result.getErrors().size());
        IngestionError error = result.getErrors().get(0);
        assertEquals("ValueError", error.getErrorType());
        assertTrue(error.getExpDir().endsWith("3.250101-000000"));
    }

    @Test
    public void missingRunStartDateIsAValueErrorDespiteATimingReportDate() throws IOException {
        new ExperimentFixture().runStartDate(null).writeTo(caseDir(), "1234567.250101-120000");
        Path archive = ExperimentFixture.tarGz(tmp.getRoot().toPath().resolve("src"),
                tmp.getRoot().toPath().resolve("archive.tar.gz"));

        IngestArchiveResult result = ingester.ingest(archive, tmp.newFolder("out").toPath());

        assertEquals(0, result.getCreatedCount());
        assertEquals(1, result.getErrors().size());
        assertEquals("ValueError", result.getErrors().get(0).getErrorType());
        assertEquals("simulation_start_date is required but could not be parsed", result.getErrors().get(0).getError());
    }

    @Test
    public void unknownMachineIsALookupError() throws IOException {
        new ExperimentFixture().machine("perlmutter").writeTo(caseDir(), "1234567.250101-120000");
        Path archive = ExperimentFixture.tarGz(tmp.getRoot().toPath().resolve("src"),
                tmp.getRoot().toPath().resolve("archive.tar.gz"));

        IngestArchiveResult result = ingester.ingest(archive, tmp.newFolder("out").toPath());

        assertEquals(0, result.getCreatedCount());
        assertEquals("LookupError", result.getErrors().get(0).getErrorType());
    }

    @Test(expected = NoExperimentsFoundException.class)
    public void archiveWithoutExperimentsIsRejected() throws IOException {
        Files.writeString(caseDir().resolve("notes.txt"), "nothing here");
        Path archive = ExperimentFixture.zip(tmp.getRoot().toPath().resolve("src"),
                tmp.getRoot().toPath().resolve("archive.zip"));

        ingester.ingest(archive, tmp.newFolder("out").toPath());
    }

    @Test(expected = AmbiguousFileMatchException.class)
    public void ambiguousFilesRejectTheArchive() throws IOException {
        Path dir = new ExperimentFixture().writeTo(caseDir(), "1234567.250101-120000");
        ExperimentFixture.writeGz(dir.resolve("CaseStatus.1234567.250101-120000.bak.gz"), "");
        Path archive = ExperimentFixture.zip(tmp.getRoot().toPath().resolve("src"),
                tmp.getRoot().toPath().resolve("archive.zip"));

        ingester.ingest(archive, tmp.newFolder("out").toPath());
    }

    @Test
    public void unsafeArchiveProducesNoRecords() throws IOException {
        Path archive = tmp.getRoot().toPath().resolve("evil.zip");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(archive))) {
            zip.putNextEntry(new ZipEntry("../../1.1-1/e3sm_timing.x.y"));
            zip.closeEntry();
        }
        try {
            ingester.ingest(archive, tmp.newFolder("out").toPath());
            fail("expected UnsafeArchiveException");
        } catch (UnsafeArchiveException e) {
            assertEquals(UnsafeArchiveException.Reason.PATH_TRAVERSAL, e.getReason());
        }
    }
}
