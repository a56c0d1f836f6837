package simboard.ingest.parsers;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.Assert.*;

public class TimingFileParserTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final TimingFileParser parser = new TimingFileParser();

    @Test
    public void parsesHeader() throws IOException {
        Path file = tmp.getRoot().toPath().resolve("e3sm_timing.v3.LR.historical_0121.1234567.250101-120000");
        Files.writeString(file, String.join("\n",
                "---------------- TIMING PROFILE ---------------------",
                "  Case        : v3.LR.historical_0121",
                "  LID         : 1234567.250101-120000",
                "  Machine     : chrysalis",
                "  Caseroot    : /lcrc/group/e3sm/ac.jdoe/v3.LR.historical_0121/case_scripts",
                "  User        : ac.jdoe",
                "  Curr Date   : Tue Jan  3 09:05:00 2023",
                "  grid        : a%ne30np4.pg2_l%r05_oi%EC30to60E2r2",
                "  compset     : 20TR_EAM%CMIP6_ELM%CNPRDCTCBCTOP",
                "  run type    : hybrid, continue_run = FALSE (inittype = TRUE)",
                "  stop option : nyears, stop_n = 5",
                "  run length  : 1825 days (1825.0 for ocean)"));

        Map<String, String> result = parser.parse(file);

        assertEquals("v3.LR.historical_0121", result.get("case_name"));
        assertEquals("v3.LR.historical", result.get("campaign"));
        assertEquals("historical", result.get("experiment_type"));
        assertEquals("chrysalis", result.get("machine"));
        assertEquals("ac.jdoe", result.get("user"));
        assertEquals("1234567.250101-120000", result.get("lid"));
        assertEquals("2023-01-03T09:05:00", result.get("simulation_start_date"));
        assertEquals("a%ne30np4.pg2_l%r05_oi%EC30to60E2r2", result.get("grid_resolution"));
        assertEquals("20TR_EAM%CMIP6_ELM%CNPRDCTCBCTOP", result.get("compset_alias"));
        assertEquals("hybrid", result.get("initialization_type"));
        assertEquals("nyears", result.get("stop_option"));
        assertEquals("5", result.get("stop_n"));
        assertEquals("1825 days (1825.0 for ocean)", result.get("run_length"));
    }

    @Test
    public void stopNOnItsOwnLine() {
        Map<String, String> result = parser.parseLines(Arrays.asList(
                "  stop option : ndays",
                "  stop_n      = 10"));
        assertEquals("ndays", result.get("stop_option"));
        assertEquals("10", result.get("stop_n"));
    }

    @Test
    public void unrecognisedCurrDateIsKeptAsIs() {
        Map<String, String> result = parser.parseLines(Arrays.asList("  Curr Date   : 2023/01/03"));
        assertEquals("2023/01/03", result.get("simulation_start_date"));
    }

    @Test
    public void missingFieldsAreNull() {
        Map<String, String> result = parser.parseLines(Arrays.asList("nothing to see here"));
        assertNull(result.get("case_name"));
        assertNull(result.get("campaign"));
        assertNull(result.get("experiment_type"));
        assertTrue(result.containsKey("run_length"));
    }

    @Test
    public void unreadableFileYieldsEmptyResult() {
        Map<String, String> result = parser.parse(tmp.getRoot().toPath().resolve("missing"));
        assertNull(result.get("case_name"));
        assertNull(result.get("machine"));
    }

    @Test
    public void campaignAndExperimentType() {
        assertEquals("v3.LR.piControl", TimingFileParser.campaignOf("v3.LR.piControl_0042"));
        assertEquals("v3.LR.piControl", TimingFileParser.campaignOf("v3.LR.piControl"));
        assertEquals("piControl", TimingFileParser.experimentTypeOf("v3.LR.piControl"));
        assertEquals("ssp585", TimingFileParser.experimentTypeOf("v2.LR.ssp585"));
        assertNull(TimingFileParser.experimentTypeOf("v3.LR.custom"));
        assertNull(TimingFileParser.campaignOf(null));
    }
}
