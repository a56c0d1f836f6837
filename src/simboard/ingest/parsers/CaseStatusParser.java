package simboard.ingest.parsers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simboard.simulation.SimulationStatus;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a CaseStatus file: the simulated period from RUN_STARTDATE and STOP_OPTION/STOP_N, and the wall clock
 * start, end and outcome of the most recent case.run attempt.
 */
public class CaseStatusParser implements MetadataParser {
    private static final Logger log = LoggerFactory.getLogger(CaseStatusParser.class);

    private static final String TIMESTAMP = "(?<timestamp>\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2})";
    static final Pattern CASE_RUN_START = Pattern.compile(
            "^" + TIMESTAMP + ":\\s+case\\.run\\s+starting(?:\\s+(?<jobId>\\S+))?\\s*$");
    static final Pattern CASE_RUN_TERMINAL = Pattern.compile(
            "^" + TIMESTAMP + ":\\s+case\\.run\\s+(?<state>success|error)\\b");
    static final Pattern RUN_STARTDATE = Pattern.compile("RUN_STARTDATE=(?<startDate>\\d{4}-\\d{2}-\\d{2})");
    static final Pattern STOP_OPTION_STOP_N = Pattern.compile(
            "STOP_OPTION=(?<stopOption>[^,\\s]+),STOP_N=(?<stopN>\\d+)");

    @Override
    public Map<String, String> parse(Path path) {
        List<String> lines;
        try {
            lines = TextFiles.readLines(path);
        } catch (IOException e) {
            log.warn("Failed to read case status file {} ({})", path, e.toString());
            return emptyResult();
        }
        return parseLines(lines, path.toString());
    }

    Map<String, String> parseLines(List<String> lines, String source) {
        Map<String, String> result = emptyResult();
        int latestStart = -1;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher startDate = RUN_STARTDATE.matcher(line);
            if (startDate.find()) {
                result.put("simulation_start_date", startDate.group("startDate"));
            } else if (line.contains("RUN_STARTDATE")) {
                log.warn("Malformed RUN_STARTDATE line in {}: {}", source, line.strip());
            }

            Matcher stop = STOP_OPTION_STOP_N.matcher(line);
            if (stop.find()) {
                updateSimulationEndDate(source, line, stop, result);
            } else if (line.contains("STOP_OPTION") && line.contains("STOP_N")) {
                log.warn("Malformed STOP_OPTION/STOP_N line in {}: {}", source, line.strip());
            }

            if (CASE_RUN_START.matcher(line.strip()).matches()) {
                latestStart = i;
            }
        }

        if (latestStart >= 0) {
            extractLatestRun(lines, latestStart, result);
        }
        return result;
    }

    private static Map<String, String> emptyResult() {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("simulation_start_date", null);
        result.put("simulation_end_date", null);
        result.put("run_start_date", null);
        result.put("run_end_date", null);
        result.put("status", null);
        return result;
    }

    private static void updateSimulationEndDate(String source, String line, Matcher stop, Map<String, String> result) {
        int stopN;
        try {
            stopN = Integer.parseInt(stop.group("stopN"));
        } catch (NumberFormatException e) {
            log.warn("Malformed STOP_OPTION/STOP_N line in {}: {} ({})", source, line.strip(), e.getMessage());
            return;
        }
        result.put("simulation_end_date",
                calculateSimulationEndDate(result.get("simulation_start_date"), stop.group("stopOption"), stopN));
    }

    private static void extractLatestRun(List<String> lines, int latestStart, Map<String, String> result) {
        Matcher start = CASE_RUN_START.matcher(lines.get(latestStart).strip());
        if (!start.matches()) {
            return;
        }
        result.put("run_start_date", start.group("timestamp"));

        for (String line : lines.subList(latestStart + 1, lines.size())) {
            Matcher terminal = CASE_RUN_TERMINAL.matcher(line.strip());
            if (!terminal.lookingAt()) {
                continue;
            }
            result.put("run_end_date", terminal.group("timestamp"));
            SimulationStatus status = "success".equals(terminal.group("state"))
                    ? SimulationStatus.COMPLETED : SimulationStatus.FAILED;
            result.put("status", status.value());
            return;
        }

        result.put("status", SimulationStatus.RUNNING.value());
    }

    /**
     * Adds STOP_N units of the STOP_OPTION (ndays, nmonths, nyears...) to the start date.
     *
     * @return the end date as yyyy-MM-dd, or null if the start date is unknown or the unit isn't supported
     */
    static String calculateSimulationEndDate(String simulationStartDate, String stopOption, int stopN) {
        if (simulationStartDate == null || stopOption == null || stopN == 0) {
            return null;
        }
        LocalDate start;
        try {
            start = LocalDate.parse(simulationStartDate);
        } catch (DateTimeParseException e) {
            return null;
        }

        String option = stopOption.toLowerCase(Locale.ROOT);
        LocalDate end;
        if (option.contains("days")) {
            end = start.plusDays(stopN);
        } else if (option.contains("months")) {
            end = start.plusMonths(stopN);
        } else if (option.contains("years")) {
            end = start.plusYears(stopN);
        } else {
            return null;
        }
        return end.toString();
    }
}
