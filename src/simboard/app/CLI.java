package simboard.app;

import com.google.gson.Gson;
import org.apache.commons.io.FileUtils;
import simboard.archive.ArchiveRejectedException;
import simboard.core.Config;
import simboard.ingest.IngestionReport;
import simboard.ingest.IngestionSourceType;
import simboard.machine.Machine;
import simboard.util.Json;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CLI {
    private static final Gson gson = Json.pretty();

    public static void usage() {
        System.out.println("Usage: simboard <subcommand>");
        System.out.println("SimBoard archive ingestion tools");
        System.out.println("\nSub-commands:");
        System.out.println("  ingest <archive> [output-dir]            - Ingest a .zip, .tar.gz or .tgz performance archive");
        System.out.println("  add-machine <name> <site> <architecture> <scheduler> [gpu]");
        System.out.println("                                           - Register a machine");
        System.out.println("  machines                                 - List registered machines");
        System.out.println("  ingestions                               - List past ingestions");
        System.out.println("  healthcheck                              - Check the database connection");
        System.exit(1);
    }

    public static void main(String[] args) throws IOException {
        if (args.length == 0) {
            usage();
            return;
        }
        try (Simboard simboard = new Simboard(new Config(System.getenv()))) {
            switch (args[0]) {
                case "ingest": {
                    if (args.length < 2) {
                        usage();
                    }
                    Path archive = Paths.get(args[1]);
                    if (!Files.exists(archive)) {
                        System.err.println("File not found: " + archive);
                        System.exit(1);
                    }
                    IngestionReport report;
                    try {
                        report = ingest(simboard, archive, args.length > 2 ? Paths.get(args[2]) : null);
                    } catch (ArchiveRejectedException e) {
                        System.err.println("Archive rejected: " + e.getMessage());
                        System.exit(2);
                        return;
                    }
                    System.out.println(gson.toJson(report));
                    break;
                }

                case "add-machine": {
                    if (args.length < 5) {
                        usage();
                    }
                    Machine machine = new Machine();
                    machine.setName(args[1]);
                    machine.setSite(args[2]);
                    machine.setArchitecture(args[3]);
                    machine.setScheduler(args[4]);
                    machine.setGpu(args.length > 5 && Boolean.parseBoolean(args[5]));
                    long id = simboard.machines.create(machine);
                    System.out.println(gson.toJson(simboard.machines.get(id)));
                    break;
                }

                case "machines":
                    System.out.println(gson.toJson(simboard.machines.listAll()));
                    break;

                case "ingestions":
                    System.out.println(gson.toJson(simboard.ingestions.listAll()));
                    break;

                case "healthcheck": {
                    PrintWriter out = new PrintWriter(System.out, true);
                    if (!simboard.healthcheck(out)) {
                        System.exit(1);
                    }
                    break;
                }

                default:
                    usage();
            }
        }
    }

    /**
     * Ingests into {@code outputDir}, or into a scratch directory under the work dir that is removed afterwards.
     */
    static IngestionReport ingest(Simboard simboard, Path archive, Path outputDir) throws IOException {
        String user = System.getProperty("user.name");
        if (outputDir != null) {
            return simboard.ingestions.ingestAndPersist(archive, outputDir, IngestionSourceType.HPC_PATH, user);
        }
        Files.createDirectories(simboard.config.getWorkDir());
        Path scratch = Files.createTempDirectory(simboard.config.getWorkDir(), "simboard-ingest-");
        try {
            return simboard.ingestions.ingestAndPersist(archive, scratch, IngestionSourceType.HPC_PATH, user);
        } finally {
            FileUtils.deleteDirectory(scratch.toFile());
        }
    }
}
