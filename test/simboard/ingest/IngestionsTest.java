package simboard.ingest;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import simboard.archive.UnsupportedArchiveFormatException;
import simboard.core.Fixtures;
import simboard.machine.Machines;
import simboard.simulation.Simulations;
import simboard.util.Digests;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class IngestionsTest {

    @ClassRule
    public static Fixtures fixtures = new Fixtures();

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Ingestions ingestions() {
        return new Ingestions(fixtures.dao, IngestConfig.defaults(), new Machines(fixtures.dao.machines()),
                new Simulations(fixtures.dao.simulations()));
    }

    private Path archive(String... caseNames) throws IOException {
        Path src = tmp.newFolder("src").toPath();
        int lid = 1;
        for (String caseName : caseNames) {
            Path caseDir = Files.createDirectories(src.resolve("performance_archive/chrysalis/" + caseName));
            new ExperimentFixture().caseName(caseName).writeTo(caseDir, lid++ + ".250101-000000");
        }
        return ExperimentFixture.tarGz(src, tmp.getRoot().toPath().resolve("archive.tar.gz"));
    }

    @Test
    public void reingestingTheSameArchiveIsIdempotent() throws IOException {
        Path archive = archive("idem.case_0001", "idem.case_0002");
        Ingestions ingestions = ingestions();
        Simulations simulations = new Simulations(fixtures.dao.simulations());
        long before = simulations.count();

        IngestionReport first = ingestions.ingestAndPersist(archive, tmp.newFolder("out1").toPath(),
                IngestionSourceType.HPC_PATH, "alice");
        IngestionReport second = ingestions.ingestAndPersist(archive, tmp.newFolder("out2").toPath(),
                IngestionSourceType.HPC_PATH, "alice");

        assertEquals(2, first.getResult().getCreatedCount());
        assertEquals(0, second.getResult().getCreatedCount());
        assertEquals(first.getResult().getCreatedCount(), second.getResult().getDuplicateCount());
        assertEquals(before + 2, simulations.count());

        assertEquals(IngestionStatus.SUCCESS, second.getIngestion().getStatus());
        assertEquals(2, fixtures.dao.simulations().countSimulationsForIngestion(first.getIngestion().getId()));
        assertEquals(0, fixtures.dao.simulations().countSimulationsForIngestion(second.getIngestion().getId()));
    }

    @Test
    public void auditRecordIsStored() throws IOException {
        Path archive = archive("audit.case_0001");

        IngestionReport report = ingestions().ingestAndPersist(archive, tmp.newFolder("out").toPath(),
                IngestionSourceType.BROWSER_UPLOAD, "bob");

        Ingestion stored = ingestions().get(report.getIngestion().getId());
        assertEquals(IngestionSourceType.BROWSER_UPLOAD, stored.getSourceType());
        assertEquals(archive.toString(), stored.getSourceReference());
        assertEquals("bob", stored.getTriggeredBy());
        assertEquals(IngestionStatus.SUCCESS, stored.getStatus());
        assertEquals(1, stored.getCreatedCount());
        assertEquals(0, stored.getErrorCount());
        assertEquals(Digests.sha256(archive), stored.getArchiveSha256());
        assertNotNull(stored.getCreatedAt());
        assertTrue(ingestions().listAll().size() >= 1);
    }

    @Test
    public void configDeltasArePersistedInExtra() throws IOException {
        Path src = tmp.newFolder("src").toPath();
        Path caseDir = Files.createDirectories(src.resolve("performance_archive/chrysalis/delta.case_0001"));
        new ExperimentFixture().caseName("delta.case_0001").writeTo(caseDir, "1.250101-000000");
        new ExperimentFixture().caseName("delta.case_0001").compset("F2010").runStartDate("1855-01-01")
                .writeTo(caseDir, "2.250101-000000");
        Path archive = ExperimentFixture.zip(src, tmp.getRoot().toPath().resolve("archive.zip"));

        ingestions().ingestAndPersist(archive, tmp.newFolder("out").toPath(), IngestionSourceType.HPC_UPLOAD, "carol");

        List<String> extras = fixtures.dao.simulations().findExtraByCaseName("delta.case_0001");
        assertEquals(1, extras.size());
        JsonObject extra = JsonParser.parseString(extras.get(0)).getAsJsonObject();
        JsonArray deltas = extra.getAsJsonArray("run_config_deltas");
        assertEquals(1, deltas.size());
        JsonObject compset = deltas.get(0).getAsJsonObject().getAsJsonObject("deltas").getAsJsonObject("compset");
        assertEquals("WCYCL20TR", compset.get("canonical").getAsString());
        assertEquals("F2010", compset.get("current").getAsString());
        assertTrue(deltas.get(0).getAsJsonObject().get("exp_dir").getAsString().endsWith("2.250101-000000"));
    }

    @Test
    public void partialAndFailedIngestions() throws IOException {
        Path src = tmp.newFolder("src").toPath();
        Path root = src.resolve("performance_archive/chrysalis");
        new ExperimentFixture().caseName("partial.ok_0001")
                .writeTo(Files.createDirectories(root.resolve("ok")), "1.250101-000000");
        new ExperimentFixture().caseName("partial.bad_0001").machine("aurora")
                .writeTo(Files.createDirectories(root.resolve("bad")), "2.250101-000000");
        Path archive = ExperimentFixture.tarGz(src, tmp.getRoot().toPath().resolve("archive.tgz"));

        IngestionReport first = ingestions().ingestAndPersist(archive, tmp.newFolder("out1").toPath(),
                IngestionSourceType.HPC_PATH, null);
        IngestionReport second = ingestions().ingestAndPersist(archive, tmp.newFolder("out2").toPath(),
                IngestionSourceType.HPC_PATH, null);

        assertEquals(IngestionStatus.PARTIAL, first.getIngestion().getStatus());
        assertEquals(1, first.getIngestion().getErrorCount());
        assertEquals(IngestionStatus.FAILED, second.getIngestion().getStatus());
        assertEquals(1, second.getIngestion().getDuplicateCount());
    }

    @Test
    public void rejectedArchivesStoreNothing() throws IOException {
        Path archive = tmp.newFile("archive.rar").toPath();
        int before = ingestions().listAll().size();
        try {
            ingestions().ingestAndPersist(archive, tmp.newFolder("out").toPath(), IngestionSourceType.HPC_PATH, null);
            fail("expected UnsupportedArchiveFormatException");
        } catch (UnsupportedArchiveFormatException e) {
            assertEquals(before, ingestions().listAll().size());
        }
    }
}
