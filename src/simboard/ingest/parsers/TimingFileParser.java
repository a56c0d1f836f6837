package simboard.ingest.parsers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simboard.simulation.ExperimentType;
import simboard.util.Dates;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the header of an E3SM timing file (e3sm_timing.*), which records the case, machine, user, grid, compset
 * and run configuration of a completed run.
 */
public class TimingFileParser implements MetadataParser {
    private static final Logger log = LoggerFactory.getLogger(TimingFileParser.class);

    private static final Map<String, Pattern> HEADER_FIELDS = new LinkedHashMap<>();
    static {
        HEADER_FIELDS.put("case_name", Pattern.compile("Case\\s*[:=]\\s*(.+)"));
        HEADER_FIELDS.put("machine", Pattern.compile("Machine\\s*[:=]\\s*(.+)"));
        HEADER_FIELDS.put("user", Pattern.compile("User\\s*[:=]\\s*(.+)"));
        HEADER_FIELDS.put("lid", Pattern.compile("LID\\s*[:=]\\s*(.+)"));
        HEADER_FIELDS.put("curr_date", Pattern.compile("Curr Date\\s*[:=]\\s*(.+)"));
        HEADER_FIELDS.put("grid_resolution", Pattern.compile("grid\\s*[:=]\\s*(.+)"));
        HEADER_FIELDS.put("compset_alias", Pattern.compile("compset\\s*[:=]\\s*(.+)"));
        HEADER_FIELDS.put("initialization_type", Pattern.compile("run type\\s*[:=]\\s*([^,]+)"));
        HEADER_FIELDS.put("run_length", Pattern.compile("run length\\s*[:=]\\s*(.+)"));
    }

    private static final Pattern INSTANCE_SUFFIX = Pattern.compile("_\\d+$");
    private static final Pattern STOP_OPTION = Pattern.compile("stop option\\s*[:=]\\s*([^,]+)");
    private static final Pattern STOP_N_INLINE = Pattern.compile("stop_n\\s*[=:]\\s*(\\d+)");
    private static final Pattern STOP_N_LINE = Pattern.compile("stop_n\\s*[=:]\\s*(.+)");

    @Override
    public Map<String, String> parse(Path path) {
        List<String> lines;
        try {
            lines = TextFiles.readLines(path);
        } catch (IOException e) {
            log.warn("Failed to read timing file {}", path, e);
            return parseLines(List.of());
        }
        return parseLines(lines);
    }

    Map<String, String> parseLines(List<String> lines) {
        Map<String, String> header = new LinkedHashMap<>();
        for (Map.Entry<String, Pattern> field : HEADER_FIELDS.entrySet()) {
            header.put(field.getKey(), extract(lines, field.getValue()));
        }

        String caseName = header.get("case_name");
        String campaign = campaignOf(caseName);

        Map<String, String> result = new LinkedHashMap<>();
        result.put("case_name", caseName);
        result.put("campaign", campaign);
        result.put("experiment_type", experimentTypeOf(campaign));
        result.put("machine", header.get("machine"));
        result.put("user", header.get("user"));
        result.put("lid", header.get("lid"));
        result.put("simulation_start_date", reformatCurrDate(header.get("curr_date")));
        result.put("grid_resolution", header.get("grid_resolution"));
        result.put("compset_alias", header.get("compset_alias"));
        result.put("initialization_type", header.get("initialization_type"));
        extractStopOptionAndStopN(lines, result);
        result.put("run_length", header.get("run_length"));
        return result;
    }

    /**
     * The campaign is the case name without its trailing numeric instance suffix, e.g. v3.LR.historical_0121
     * belongs to campaign v3.LR.historical.
     */
    static String campaignOf(String caseName) {
        if (caseName == null) {
            return null;
        }
        return INSTANCE_SUFFIX.matcher(caseName).replaceFirst("");
    }

    static String experimentTypeOf(String campaign) {
        if (campaign == null) {
            return null;
        }
        String candidate = campaign.substring(campaign.lastIndexOf('.') + 1);
        return ExperimentType.isKnown(candidate) ? candidate : null;
    }

    /**
     * Converts the ctime formatted "Curr Date" to ISO-8601, keeping the raw text if it is in some other format.
     */
    static String reformatCurrDate(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        LocalDateTime parsed = Dates.parseCtime(value);
        return parsed != null ? DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(parsed) : value;
    }

    private static void extractStopOptionAndStopN(List<String> lines, Map<String, String> result) {
        String stopOption = null;
        String stopN = null;
        for (String line : lines) {
            Matcher m = STOP_OPTION.matcher(line.strip());
            if (m.lookingAt()) {
                stopOption = m.group(1).strip();
                Matcher inline = STOP_N_INLINE.matcher(line);
                if (inline.find()) {
                    stopN = inline.group(1);
                }
                break;
            }
        }
        if (stopN == null) {
            stopN = extract(lines, STOP_N_LINE);
        }
        result.put("stop_option", stopOption);
        result.put("stop_n", stopN);
    }

    private static String extract(List<String> lines, Pattern pattern) {
        for (String line : lines) {
            Matcher m = pattern.matcher(line.strip());
            if (m.lookingAt()) {
                return m.group(1).strip();
            }
        }
        return null;
    }
}
