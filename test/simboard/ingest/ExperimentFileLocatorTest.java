package simboard.ingest;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.Assert.*;

public class ExperimentFileLocatorTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ExperimentFileLocator locator = new ExperimentFileLocator(FileSpecs.defaults());

    @Test
    public void locatesAllFiles() throws IOException {
        Path dir = new ExperimentFixture().writeTo(tmp.getRoot().toPath(), "1.250101-000000");

        Map<String, Path> files = locator.locate(dir);

        assertEquals(8, files.size());
        assertEquals(dir.resolve("CaseDocs.1.250101-000000/README.case.1.250101-000000.gz"), files.get("readme_case"));
        assertEquals(dir.resolve("GIT_STATUS.1.250101-000000.gz"), files.get("git_status"));
        assertEquals("e3sm_timing", files.keySet().iterator().next());
    }

    @Test
    public void optionalFilesMayBeMissing() throws IOException {
        Path dir = new ExperimentFixture().writeTo(tmp.getRoot().toPath(), "1.250101-000000");
        Files.delete(dir.resolve("GIT_CONFIG.1.250101-000000.gz"));
        Files.delete(dir.resolve("CaseDocs.1.250101-000000/env_build.xml.1.250101-000000.gz"));

        Map<String, Path> files = locator.locate(dir);

        assertFalse(files.containsKey("git_config"));
        assertFalse(files.containsKey("case_docs_env_build"));
        assertTrue(files.containsKey("case_docs_env_case"));
    }

    @Test
    public void missingRequiredFilesAreReported() throws IOException {
        Path dir = new ExperimentFixture().withoutCaseStatus().writeTo(tmp.getRoot().toPath(), "1.250101-000000");
        Files.delete(dir.resolve("GIT_DESCRIBE.1.250101-000000.gz"));

        try {
            locator.locate(dir);
            fail("expected MissingRequiredFilesException");
        } catch (MissingRequiredFilesException e) {
            assertEquals(Arrays.asList("case_status", "git_describe"), e.getMissingKeys());
        }
    }

    @Test
    public void ambiguousMatchIsFatal() throws IOException {
        Path dir = new ExperimentFixture().writeTo(tmp.getRoot().toPath(), "1.250101-000000");
        ExperimentFixture.writeGz(dir.resolve("GIT_DESCRIBE.1.250101-000000.copy.gz"), "v1.0.0-1-gabc\n");

        try {
            locator.locate(dir);
            fail("expected AmbiguousFileMatchException");
        } catch (AmbiguousFileMatchException e) {
            assertEquals("git_describe", e.getSpecKey());
            assertEquals(2, e.getMatches().size());
        }
    }

    @Test
    public void firstCaseDocsDirectoryWithAMatchWins() throws IOException {
        Path dir = new ExperimentFixture().writeTo(tmp.getRoot().toPath(), "1.250101-000000");
        Path earlier = Files.createDirectories(dir.resolve("CaseDocs.0"));
        ExperimentFixture.writeGz(earlier.resolve("env_case.xml.0.gz"), "<file/>");

        Map<String, Path> files = locator.locate(dir);

        assertEquals(earlier.resolve("env_case.xml.0.gz"), files.get("case_docs_env_case"));
        assertEquals(dir.resolve("CaseDocs.1.250101-000000/README.case.1.250101-000000.gz"), files.get("readme_case"));
    }

    @Test
    public void patternsAreAnchoredAtTheStartOfTheName() throws IOException {
        Path dir = new ExperimentFixture().writeTo(tmp.getRoot().toPath(), "1.250101-000000");
        ExperimentFixture.writeGz(dir.resolve("old.CaseStatus.1.gz"), "");

        assertEquals(dir.resolve("CaseStatus.1.250101-000000.gz"), locator.locate(dir).get("case_status"));
    }
}
