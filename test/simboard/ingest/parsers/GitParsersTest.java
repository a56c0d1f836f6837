package simboard.ingest.parsers;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.*;
import static simboard.ingest.ExperimentFixture.writeGz;

public class GitParsersTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final GitDescribeParser describe = new GitDescribeParser();

    @Test
    public void describeWithCommitCount() {
        Map<String, String> result = describe.parseLines(Arrays.asList("", "  v3.0.0-1234-gea457362f3  "));
        assertEquals("v3.0.0-1234", result.get("git_tag"));
        assertEquals("ea457362f3", result.get("git_commit_hash"));
    }

    @Test
    public void describePreReleaseTag() {
        Map<String, String> result = describe.parseLines(Arrays.asList("v2.0.0-beta.3-3091-g3219b44fc"));
        assertEquals("v2.0.0-beta.3-3091", result.get("git_tag"));
        assertEquals("3219b44fc", result.get("git_commit_hash"));
    }

    @Test
    public void describeWithoutVersionTag() {
        Map<String, String> result = describe.parseLines(Arrays.asList("release-2024-gabcdef1"));
        assertEquals("release", result.get("git_tag"));
        assertEquals("abcdef1", result.get("git_commit_hash"));
    }

    @Test
    public void describeExactTag() {
        Map<String, String> result = describe.parseLines(Arrays.asList("maint-3.0"));
        assertEquals("maint", result.get("git_tag"));
        assertNull(result.get("git_commit_hash"));
    }

    @Test
    public void describeEmpty() {
        Map<String, String> result = describe.parseLines(Collections.emptyList());
        assertNull(result.get("git_tag"));
        assertNull(result.get("git_commit_hash"));
    }

    @Test
    public void describeFromGzipFile() throws IOException {
        Path file = tmp.getRoot().toPath().resolve("GIT_DESCRIBE.1234.gz");
        writeGz(file, "v3.0.1-55-g0123abc\n");
        assertEquals("0123abc", describe.parse(file).get("git_commit_hash"));
    }

    @Test
    public void statusBranch() throws IOException {
        Path file = tmp.getRoot().toPath().resolve("GIT_STATUS.1234.gz");
        writeGz(file, "On branch maint-3.0\nYour branch is up to date with 'origin/maint-3.0'.\n");
        assertEquals("maint-3.0", new GitStatusParser().parse(file));
        assertNull(new GitStatusParser().parseLines(Arrays.asList("HEAD detached at 1234abc")));
    }

    @Test
    public void configOriginUrl() throws IOException {
        Path file = tmp.getRoot().toPath().resolve("GIT_CONFIG.1234.gz");
        writeGz(file, "[core]\n\tbare = false\n[remote \"upstream\"]\n\turl = https://example.org/fork.git\n" +
                "[remote \"origin\"]\n\turl = git@github.com:E3SM-Project/E3SM.git\n");
        assertEquals("git@github.com:E3SM-Project/E3SM.git", new GitConfigParser().parse(file));
    }

    @Test
    public void configStopsAtNextSection() {
        GitConfigParser parser = new GitConfigParser();
        assertNull(parser.parseLines(Arrays.asList(
                "[remote \"origin\"]",
                "\tfetch = +refs/heads/*:refs/remotes/origin/*",
                "[branch \"master\"]",
                "\turl = https://not.the.origin/")));
    }
}
