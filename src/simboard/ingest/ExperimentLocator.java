package simboard.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds experiment directories (named like {@code 1234567.250101-120000}) anywhere below an extracted archive.
 */
public class ExperimentLocator {
    static final Pattern EXPERIMENT_DIR_NAME = Pattern.compile("\\d+\\.\\d+-\\d+");

    private final Logger log;

    public ExperimentLocator() {
        this(LoggerFactory.getLogger(ExperimentLocator.class));
    }

    public ExperimentLocator(Logger log) {
        this.log = log;
    }

    /**
     * @return the experiment directories sorted by path
     * @throws NoExperimentsFoundException if there are none
     */
    public List<Path> findExperimentDirs(Path rootDir) throws IOException {
        List<Path> dirs;
        try (Stream<Path> stream = Files.walk(rootDir)) {
            dirs = stream.filter(p -> !p.equals(rootDir))
                    .filter(Files::isDirectory)
                    .filter(ExperimentLocator::isExperimentDir)
                    .sorted()
                    .collect(Collectors.toList());
        }
        if (dirs.isEmpty()) {
            throw new NoExperimentsFoundException(rootDir);
        }
        log.info("Found {} experiment directories in {}", dirs.size(), rootDir);
        return dirs;
    }

    static boolean isExperimentDir(Path path) {
        Path name = path.getFileName();
        return name != null && EXPERIMENT_DIR_NAME.matcher(name.toString()).matches();
    }
}
