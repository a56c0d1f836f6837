package simboard.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Matches the files of an experiment directory against the file specs.
 */
public class ExperimentFileLocator {
    private final Logger log;
    private final List<FileSpec> fileSpecs;

    public ExperimentFileLocator(List<FileSpec> fileSpecs) {
        this(fileSpecs, LoggerFactory.getLogger(ExperimentFileLocator.class));
    }

    public ExperimentFileLocator(List<FileSpec> fileSpecs, Logger log) {
        this.fileSpecs = List.copyOf(fileSpecs);
        this.log = log;
    }

    /**
     * Locates the file for each spec.
     *
     * @return spec key to file, in spec order, containing only the specs that matched
     * @throws AmbiguousFileMatchException if a spec matches more than one file in the same directory
     * @throws MissingRequiredFilesException if a required spec has no match
     */
    public Map<String, Path> locate(Path experimentDir) throws IOException {
        List<Path> children = list(experimentDir);
        List<Path> nestedDirs = children.stream().filter(Files::isDirectory).collect(Collectors.toList());

        Map<String, Path> files = new LinkedHashMap<>();
        List<String> missingRequired = new ArrayList<>();
        List<String> missingOptional = new ArrayList<>();

        for (FileSpec spec : fileSpecs) {
            Path match;
            if (spec.getLocation() == FileSpec.Location.ROOT) {
                match = findInDirectory(experimentDir, children, spec);
            } else {
                match = findInSubdirectories(nestedDirs, spec);
            }

            if (match != null) {
                files.put(spec.getKey(), match);
            } else if (spec.isRequired()) {
                missingRequired.add(spec.getKey());
            } else {
                missingOptional.add(spec.getKey());
            }
        }

        if (!missingRequired.isEmpty()) {
            throw new MissingRequiredFilesException(experimentDir, missingRequired);
        }
        if (!missingOptional.isEmpty()) {
            log.debug("Optional files missing in experiment directory {}: {}", experimentDir,
                    String.join(", ", missingOptional));
        }
        return files;
    }

    private Path findInSubdirectories(List<Path> nestedDirs, FileSpec spec) throws IOException {
        for (Path dir : nestedDirs) {
            if (!dir.getFileName().toString().startsWith(spec.getSubdirPrefix())) {
                continue;
            }
            Path match = findInDirectory(dir, list(dir), spec);
            if (match != null) {
                return match;
            }
        }
        return null;
    }

    private static Path findInDirectory(Path directory, List<Path> entries, FileSpec spec) {
        List<Path> matches = new ArrayList<>();
        for (Path entry : entries) {
            if (Files.isRegularFile(entry) && spec.matches(entry.getFileName().toString())) {
                matches.add(entry);
            }
        }
        if (matches.size() > 1) {
            throw new AmbiguousFileMatchException(spec.getKey(), directory, matches);
        }
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static List<Path> list(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.sorted().collect(Collectors.toList());
        }
    }
}
